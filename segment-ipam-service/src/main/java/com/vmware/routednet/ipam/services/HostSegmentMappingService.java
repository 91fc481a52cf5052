/*
 * Copyright (c) 2020 VMware, Inc. All rights reserved. VMware Confidential
 */

package com.vmware.routednet.ipam.services;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.google.common.collect.ImmutableSet;
import com.vmware.routednet.common.exception.BadRequestException;
import com.vmware.routednet.common.exception.ErrorCode;
import com.vmware.routednet.ipam.services.dao.IpamDao;
import com.vmware.routednet.ipam.services.dao.Segment;
import com.vmware.routednet.ipam.services.exception.SegmentNotFoundException;

import lombok.extern.slf4j.Slf4j;

/**
 * Which hosts reach which segments. Mappings are set explicitly or derived from the physical networks a host
 * reports: a host reaching physical network P is mapped to every segment on P.
 */
@Slf4j
@Component
public class HostSegmentMappingService {

    private final IpamDao dao;
    private final Map<String, Set<String>> reportedPhysicalNetworks = new ConcurrentHashMap<>();

    @Autowired
    public HostSegmentMappingService(IpamDao dao) {
        this.dao = dao;
    }

    public void map(String host, UUID segmentId) {
        requireHost(host);
        if (dao.getSegment(segmentId) == null) {
            throw new SegmentNotFoundException(segmentId);
        }
        dao.addHostMapping(host, segmentId);
        log.info("Mapped host {} to segment({})", host, segmentId);
    }

    /**
     * @return false if the mapping did not exist.
     */
    public boolean unmap(String host, UUID segmentId) {
        requireHost(host);
        boolean removed = dao.removeHostMapping(host, segmentId);
        if (removed) {
            log.info("Unmapped host {} from segment({})", host, segmentId);
        }
        return removed;
    }

    public Set<UUID> segmentsForHost(String host) {
        requireHost(host);
        return dao.getSegmentsForHost(host);
    }

    public Set<String> hostsForSegment(UUID segmentId) {
        return dao.getHostsForSegment(segmentId);
    }

    /**
     * Replace the mappings of a host with the segments on the physical networks it reports.
     */
    public synchronized void updateHostPhysicalNetworks(String host, Set<String> physicalNetworks) {
        requireHost(host);
        Set<String> reported = ImmutableSet.copyOf(physicalNetworks);
        reportedPhysicalNetworks.put(host, reported);

        Set<UUID> desired = new HashSet<>();
        for (Segment segment : dao.listAllSegments()) {
            if (segment.getPhysicalNetwork() != null && reported.contains(segment.getPhysicalNetwork())) {
                desired.add(segment.getId());
            }
        }
        Set<UUID> current = dao.getSegmentsForHost(host);
        for (UUID stale : current) {
            if (!desired.contains(stale)) {
                dao.removeHostMapping(host, stale);
            }
        }
        for (UUID segmentId : desired) {
            if (!current.contains(segmentId)) {
                dao.addHostMapping(host, segmentId);
            }
        }
        log.info("Host {} reports physical networks {}, mapped to segments {}", host, reported, desired);
    }

    /**
     * Map a new segment to the hosts that already reported its physical network.
     */
    public synchronized void segmentCreated(Segment segment) {
        if (segment.getPhysicalNetwork() == null) {
            return;
        }
        reportedPhysicalNetworks.forEach((host, physicalNetworks) -> {
            if (physicalNetworks.contains(segment.getPhysicalNetwork())) {
                dao.addHostMapping(host, segment.getId());
                log.debug("Mapped host {} to new segment({})", host, segment.getId());
            }
        });
    }

    public void segmentDeleted(UUID segmentId) {
        dao.removeHostMappingsForSegment(segmentId);
    }

    private static void requireHost(String host) {
        if (host == null || host.isEmpty()) {
            throw new BadRequestException(ErrorCode.HOST_REQUIRED);
        }
    }
}
