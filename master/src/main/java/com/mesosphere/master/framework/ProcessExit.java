package com.mesosphere.master.framework;

import com.codahale.metrics.jvm.ThreadDump;

import java.lang.management.ManagementFactory;

/**
 * Exits the master process after a fatal error.
 */
public class ProcessExit {

    public static final Code DEADLOCK_ENCOUNTERED = new Code(3, "DEADLOCK_ENCOUNTERED");

    private ProcessExit() {
        // do not instantiate
    }

    /**
     * Immediately exits the process with the value of the provided {@link Code}, after dumping all thread stacks.
     */
    @SuppressWarnings("DM_EXIT")
    public static void exit(Code code) {
        String message = String.format("Process exiting immediately with code: %s[%d]", code, code.getValue());
        System.err.println(message);
        System.out.println(message);
        System.err.println("Printing final thread state...");
        new ThreadDump(ManagementFactory.getThreadMXBean()).dump(System.err);
        System.exit(code.getValue());
    }

    /**
     * Similar to {@link #exit(Code)}, except also prints the stack trace of the provided exception before exiting.
     */
    public static void exit(Code code, Throwable e) {
        e.printStackTrace(System.err);
        exit(code);
    }

    /**
     * A reason for the master process to exit.
     */
    public static class Code {
        private final int value;
        private final String name;

        private Code(int value, String name) {
            this.value = value;
            this.name = name;
        }

        public int getValue() {
            return value;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
