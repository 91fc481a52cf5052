/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Segment-aware IPAM service for routed provider networks.
 */
@SpringBootApplication
@ComponentScan({"com.vmware.routednet.ipam.*"})
public class Application {

    /**
     * Main entry point for the server instance.
     *
     * @param args
     *   server startup arguments from command-line.
     */
    public static void main(String[] args) throws Exception {
        SpringApplication.run(Application.class, args);
    }

}
