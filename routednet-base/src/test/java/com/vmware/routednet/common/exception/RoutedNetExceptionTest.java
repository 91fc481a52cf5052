/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.common.exception;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

/**
 * Tests for the exception hierarchy.
 */
class RoutedNetExceptionTest {

    @Test
    void formatsMessageWithArguments() {
        RoutedNetException e = new NotFoundException(ErrorCode.SEGMENT_NOT_FOUND, "seg-1");
        assertEquals("Segment seg-1 could not be found", e.getMessage());
        assertEquals(HttpStatus.NOT_FOUND, e.getHttpStatus());
        assertArrayEquals(new Object[] {"seg-1"}, e.getArgs());
    }

    @Test
    void statusFollowsSubclass() {
        assertEquals(HttpStatus.BAD_REQUEST, new BadRequestException(ErrorCode.INVALID_CIDR, "x").getHttpStatus());
        assertEquals(HttpStatus.CONFLICT, new ConflictException(ErrorCode.POOL_EXHAUSTED, "s").getHttpStatus());
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE,
                     new ServiceUnavailableException(ErrorCode.PLACEMENT_UNREACHABLE, "x").getHttpStatus());
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR,
                     new RoutedNetException(ErrorCode.INVALID_CONFIGURATION, "a", "b").getHttpStatus());
    }

    @Test
    void concurrentUpdateIsConflictAndKeepsCause() {
        IOException cause = new IOException("interrupted");
        ConcurrentUpdateException e = new ConcurrentUpdateException(cause, "subnet s1");
        assertEquals(HttpStatus.CONFLICT, e.getHttpStatus());
        assertSame(cause, e.getCause());
        assertEquals("Timed out waiting for exclusive access to subnet s1", e.getMessage());
    }
}
