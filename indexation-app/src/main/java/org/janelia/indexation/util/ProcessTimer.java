package org.janelia.indexation.util;

/**
 * Utility to track elapsed processing time for log messages.
 *
 * @author Eric Trautman
 */
public class ProcessTimer {

    private final long start;

    public ProcessTimer() {
        this.start = System.currentTimeMillis();
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    public long getElapsedSeconds() {
        return getElapsedMilliseconds() / 1000;
    }

    @Override
    public String toString() {
        final long totalSeconds = getElapsedSeconds();
        final long minutes = totalSeconds / 60;
        final long seconds = totalSeconds % 60;
        final long milliseconds = getElapsedMilliseconds() % 1000;
        return minutes + " minutes, " + seconds + "." + String.format("%03d", milliseconds) + " seconds";
    }
}
