package com.cataphract.repository;

import com.cataphract.model.Campaign;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local campaign store. Ids start at 1.
 */
@Repository
public class InMemoryCampaignRepository implements CampaignRepository {

    private final ConcurrentHashMap<Integer, Campaign> campaigns = new ConcurrentHashMap<>();
    private final AtomicInteger sequence = new AtomicInteger();

    @Override
    public Optional<Campaign> findById(int campaignId) {
        return Optional.ofNullable(campaigns.get(campaignId));
    }

    @Override
    public List<Campaign> findAll() {
        return campaigns.values().stream()
                .sorted(Comparator.comparingInt(Campaign::getId))
                .toList();
    }

    @Override
    public Campaign save(Campaign campaign) {
        if (campaign.getId() <= 0) {
            campaign.setId(sequence.incrementAndGet());
        } else {
            sequence.accumulateAndGet(campaign.getId(), Math::max);
        }
        campaigns.put(campaign.getId(), campaign);
        return campaign;
    }

    @Override
    public boolean existsById(int campaignId) {
        return campaigns.containsKey(campaignId);
    }
}
