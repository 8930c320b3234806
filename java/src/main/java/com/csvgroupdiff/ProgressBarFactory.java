package com.csvgroupdiff;

import me.tongfei.progressbar.ProgressBar;
import me.tongfei.progressbar.ProgressBarBuilder;
import me.tongfei.progressbar.ProgressBarStyle;

/**
 * Builds progress bars for the command line steps. In debug mode the bars still
 * count but render nothing.
 */
public class ProgressBarFactory {
    private final boolean debug;

    public ProgressBarFactory(boolean debug) {
        this.debug = debug;
    }

    public ProgressBar create(String taskName, long maxValue) {
        return builder(taskName, maxValue).build();
    }

    public ProgressBar create(String taskName, long maxValue, String unit) {
        return builder(taskName, maxValue).setUnit(unit, 1).build();
    }

    private ProgressBarBuilder builder(String taskName, long maxValue) {
        ProgressBarBuilder builder = new ProgressBarBuilder()
                .setTaskName(taskName)
                .setInitialMax(maxValue)
                .setStyle(ProgressBarStyle.ASCII);
        if (debug) {
            builder.setConsumer(new NoOpProgressBarConsumer());
        }
        return builder;
    }
}
