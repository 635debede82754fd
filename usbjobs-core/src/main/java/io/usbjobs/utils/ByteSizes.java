package io.usbjobs.utils;

/**
 * Human-readable byte counts for log messages, e.g. "1.5 GB".
 */
public final class ByteSizes {
    private static final String[] UNITS = {"Bytes", "KB", "MB", "GB", "TB"};

    private ByteSizes() {
    }

    public static String format(long bytes) {
        if (bytes <= 0) {
            return "0 Bytes";
        }
        int i = (int) Math.floor(Math.log(bytes) / Math.log(1024));
        i = Math.min(i, UNITS.length - 1);
        double scaled = bytes / Math.pow(1024, i);
        double rounded = Math.round(scaled * 100) / 100.0;
        if (rounded == Math.rint(rounded)) {
            return (long) rounded + " " + UNITS[i];
        }
        return rounded + " " + UNITS[i];
    }
}
