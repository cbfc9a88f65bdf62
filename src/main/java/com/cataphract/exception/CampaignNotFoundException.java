package com.cataphract.exception;

/**
 * Thrown when a request names a campaign that is not stored.
 */
public class CampaignNotFoundException extends RuntimeException {

    public CampaignNotFoundException(int campaignId) {
        super("Campaign not found: " + campaignId);
    }
}
