package com.cataphract;

import com.cataphract.config.ScenarioLoader;
import com.cataphract.controller.CampaignController;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CataphractApplicationTest {

    @Autowired
    private CampaignController campaignController;

    @Autowired
    private ScenarioLoader scenarioLoader;

    @Test
    void contextLoads() {
        assertNotNull(campaignController);
        assertNotNull(scenarioLoader.getScenario("border-war"));
    }
}
