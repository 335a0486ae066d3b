package com.umitunal.qcron;

import com.umitunal.qcron.examples.TwoInstanceExample;

/**
 * Entry point that runs the two-instance demo.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== QCron Example ===\n");

        TwoInstanceExample.main(args);

        System.out.println("\n=== Example Complete ===");
    }
}
