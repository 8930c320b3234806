package com.csvgroupdiff;

import me.tongfei.progressbar.ProgressBarConsumer;

/**
 * Swallows progress bar output; used in debug mode where log lines go to the console instead.
 */
public class NoOpProgressBarConsumer implements ProgressBarConsumer {
    @Override
    public int getMaxRenderedLength() {
        return 0;
    }

    @Override
    public void accept(String rendered) {
        // debug mode: console belongs to the log
    }

    @Override
    public void close() {
        // nothing was opened
    }
}
