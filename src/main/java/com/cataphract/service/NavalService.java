package com.cataphract.service;

import com.cataphract.config.RulesConfig;
import com.cataphract.dto.NavalActionResult;
import com.cataphract.model.Army;
import com.cataphract.model.Campaign;
import com.cataphract.model.Hex;
import com.cataphract.model.NavalStatus;
import com.cataphract.model.Ship;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Service responsible for embarkation and ship movement.
 */
@Service
@Slf4j
public class NavalService {

    static final int HEX_MILES = 6;

    public NavalActionResult embark(Army army, Ship ship, RulesConfig rules) {
        if (army.getEmbarkedShipId() != null) {
            return NavalActionResult.failed("army already embarked");
        }
        if (ship.getEmbarkedArmyId() != null) {
            return NavalActionResult.failed("ship already transporting an army");
        }
        if (army.getCurrentHexId() != ship.getCurrentHexId()) {
            return NavalActionResult.failed("army and ship must share a hex");
        }
        if (ship.getStatus() == NavalStatus.FLED) {
            return NavalActionResult.failed("ship status " + ship.getStatus() + " disallows embarkation");
        }

        army.setEmbarkedShipId(ship.getId());
        ship.setEmbarkedArmyId(army.getId());
        ship.setStatus(NavalStatus.TRANSPORTING);
        ship.setTravelDaysRemaining(Math.max(ship.getTravelDaysRemaining(), rules.getNaval().getEmbarkDays()));
        return NavalActionResult.ok("army embarked");
    }

    public NavalActionResult disembark(Army army, Ship ship, RulesConfig rules) {
        if (army.getEmbarkedShipId() == null || army.getEmbarkedShipId() != ship.getId()
                || ship.getEmbarkedArmyId() == null || ship.getEmbarkedArmyId() != army.getId()) {
            return NavalActionResult.failed("army not embarked on specified ship");
        }
        if (ship.getTravelDaysRemaining() > 0) {
            return NavalActionResult.failed("ship is still en route");
        }

        army.setEmbarkedShipId(null);
        ship.setEmbarkedArmyId(null);
        ship.setStatus(NavalStatus.AVAILABLE);
        ship.setTravelDaysRemaining(rules.getNaval().getDisembarkDays());
        army.setCurrentHexId(ship.getCurrentHexId());
        return NavalActionResult.ok("army disembarked");
    }

    /**
     * Plots a route. Each leg costs at least one hex of sailing at the
     * friendly-waters speed.
     */
    public NavalActionResult setCourse(Campaign campaign, Ship ship, List<Integer> route, RulesConfig rules) {
        if (route == null || route.isEmpty()) {
            return NavalActionResult.failed("route required");
        }
        if (ship.getEmbarkedArmyId() != null && !campaign.getArmies().containsKey(ship.getEmbarkedArmyId())) {
            return NavalActionResult.failed("embarked army missing");
        }

        int totalMiles = 0;
        int current = ship.getCurrentHexId();
        for (Integer target : route) {
            Hex from = campaign.getHexes().get(current);
            Hex to = target != null ? campaign.getHexes().get(target) : null;
            if (from == null || to == null) {
                return NavalActionResult.failed("route references unknown hex");
            }
            totalMiles += Math.max(1, from.distanceTo(to)) * HEX_MILES;
            current = target;
        }

        ship.setCurrentRoute(new ArrayList<>(route));
        ship.setTravelDaysRemaining((double) totalMiles / rules.getNaval().getFriendlyMilesPerDay());
        ship.setMovementPointsRemaining(1.0);
        ship.setStatus(ship.getEmbarkedArmyId() != null ? NavalStatus.TRANSPORTING : NavalStatus.AVAILABLE);
        return NavalActionResult.ok("course set for " + route.size() + " leg(s)");
    }

    /**
     * Advances every ship by {@code dayFraction} and lands those that arrive.
     *
     * @return ids of ships that reached the end of their route
     */
    public List<Integer> advanceShips(Campaign campaign, double dayFraction) {
        List<Integer> arrived = new ArrayList<>();
        for (Ship ship : campaign.getShips().values()) {
            ship.setTravelDaysRemaining(Math.max(0.0, ship.getTravelDaysRemaining() - dayFraction));
            if (ship.getCurrentRoute() == null || ship.getCurrentRoute().isEmpty()
                    || ship.getTravelDaysRemaining() > 0) {
                continue;
            }

            int destination = ship.getCurrentRoute().get(ship.getCurrentRoute().size() - 1);
            ship.setCurrentHexId(destination);
            ship.getCurrentRoute().clear();
            ship.setMovementPointsRemaining(0.0);
            ship.setStatus(ship.getEmbarkedArmyId() != null ? NavalStatus.TRANSPORTING : NavalStatus.AVAILABLE);
            if (ship.getEmbarkedArmyId() != null) {
                Army army = campaign.getArmies().get(ship.getEmbarkedArmyId());
                if (army != null) {
                    army.setCurrentHexId(destination);
                }
            }
            log.debug("Ship {} arrived at hex {}", ship.getId(), destination);
            arrived.add(ship.getId());
        }
        return arrived;
    }
}
