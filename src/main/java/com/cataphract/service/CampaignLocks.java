package com.cataphract.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per campaign. Every mutation of a stored campaign (a tick, an
 * order submission or a cancellation) runs while holding it.
 */
@Component
public class CampaignLocks {

    private final ConcurrentHashMap<Integer, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(int campaignId) {
        return locks.computeIfAbsent(campaignId, id -> new ReentrantLock());
    }
}
