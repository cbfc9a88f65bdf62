package com.cataphract.repository;

import com.cataphract.model.Campaign;

import java.util.List;
import java.util.Optional;

/**
 * Storage for running campaigns.
 */
public interface CampaignRepository {

    Optional<Campaign> findById(int campaignId);

    List<Campaign> findAll();

    /**
     * Stores the campaign, assigning a fresh id when it has none.
     */
    Campaign save(Campaign campaign);

    boolean existsById(int campaignId);
}
