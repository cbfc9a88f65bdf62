package com.cataphract.repository;

import com.cataphract.model.Campaign;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for InMemoryCampaignRepository.
 */
class InMemoryCampaignRepositoryTest {

    private final InMemoryCampaignRepository repository = new InMemoryCampaignRepository();

    @Test
    @DisplayName("should assign ids from 1 to unsaved campaigns")
    void shouldAssignIds() {
        Campaign first = repository.save(Campaign.builder().name("First").build());
        Campaign second = repository.save(Campaign.builder().name("Second").build());

        assertEquals(1, first.getId());
        assertEquals(2, second.getId());
        assertTrue(repository.existsById(2));
        assertSame(second, repository.findById(2).orElseThrow());
    }

    @Test
    @DisplayName("should not reuse an explicitly saved id")
    void shouldSkipPastExplicitIds() {
        repository.save(Campaign.builder().id(10).name("Imported").build());

        Campaign next = repository.save(Campaign.builder().name("Fresh").build());

        assertEquals(11, next.getId());
    }

    @Test
    @DisplayName("should list campaigns in id order")
    void shouldListInIdOrder() {
        repository.save(Campaign.builder().id(3).build());
        repository.save(Campaign.builder().id(1).build());

        List<Integer> ids = repository.findAll().stream().map(Campaign::getId).toList();

        assertEquals(List.of(1, 3), ids);
        assertTrue(repository.findById(2).isEmpty());
        assertFalse(repository.existsById(2));
    }
}
