package com.pathwise.collaborator;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlanAccessPolicyTest {

    @Test
    void unrestricted_hasNoAllowList() {
        assertTrue(PlanAccessPolicy.UNRESTRICTED.allowedPlanIds().isEmpty());
    }

    @Test
    void allowOnly_copiesTheGivenIds() {
        Set<String> ids = new HashSet<>(Set.of("deploy_service"));
        PlanAccessPolicy policy = PlanAccessPolicy.allowOnly(ids);
        ids.add("research_topic");

        assertEquals(Set.of("deploy_service"), policy.allowedPlanIds().orElseThrow());
    }
}
