package io.coordhub.validation;

import com.fasterxml.jackson.databind.JsonNode;
import io.coordhub.dispatch.CoordinationMethod;
import io.coordhub.util.Jsons;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PayloadValidatorTest {
    @Test
    void registerRequiresInstanceFieldsAndNonEmptyCapabilities() throws Exception {
        ValidationResult missing = PayloadValidator.validate(CoordinationMethod.REGISTER, json("{}"));
        assertEquals(1, missing.errors().size());
        assertTrue(missing.message().contains("instance is required"));

        ValidationResult bad = PayloadValidator.validate(CoordinationMethod.REGISTER, json("""
                {"instance": {"id": "", "kind": "wizard", "status": "idle", "capabilities": []}}
                """));
        assertEquals(3, bad.errors().size());

        ValidationResult ok = PayloadValidator.validate(CoordinationMethod.REGISTER, json("""
                {"instance": {"id": "dev-1", "kind": "developer", "status": "idle", "capabilities": ["development"],
                 "metadata": {"host": "a"}}}
                """));
        assertTrue(ok.valid());
    }

    @Test
    void enumFieldsRejectUnknownValues() throws Exception {
        assertFalse(PayloadValidator.validate(CoordinationMethod.HEARTBEAT,
                json("{\"instanceId\": \"a\", \"status\": \"sleeping\"}")).valid());
        assertFalse(PayloadValidator.validate(CoordinationMethod.CLAIM_RESOURCE,
                json("{\"resourceKind\": \"tag\", \"resourceId\": \"v1\", \"instanceId\": \"a\", \"operation\": \"write\"}")).valid());
        assertFalse(PayloadValidator.validate(CoordinationMethod.MEMORY_CREATE_RELATION,
                json("{\"from\": \"a\", \"to\": \"b\", \"relationType\": \"loves\"}")).valid());
        assertFalse(PayloadValidator.validate(CoordinationMethod.LIST_TASKS,
                json("{\"status\": \"done\"}")).valid());
        assertTrue(PayloadValidator.validate(CoordinationMethod.LIST_TASKS,
                json("{\"status\": \"in_progress\", \"kind\": \"review\"}")).valid());
    }

    @Test
    void claimRequiresOperationButReleaseDoesNot() throws Exception {
        String payload = "{\"resourceKind\": \"branch\", \"resourceId\": \"feature/x\", \"instanceId\": \"a\"}";
        assertFalse(PayloadValidator.validate(CoordinationMethod.CLAIM_RESOURCE, json(payload)).valid());
        assertTrue(PayloadValidator.validate(CoordinationMethod.RELEASE_RESOURCE, json(payload)).valid());
    }

    @Test
    void requestDeveloperChecksIssueNumberPriorityAndRequirements() throws Exception {
        assertFalse(PayloadValidator.validate(CoordinationMethod.REQUEST_DEVELOPER, json("{\"issueNumber\": \"12\"}")).valid());
        assertFalse(PayloadValidator.validate(CoordinationMethod.REQUEST_DEVELOPER,
                json("{\"issueNumber\": 12, \"priority\": \"urgent\"}")).valid());
        assertFalse(PayloadValidator.validate(CoordinationMethod.REQUEST_DEVELOPER,
                json("{\"issueNumber\": 12, \"requirements\": [1, 2]}")).valid());
        assertTrue(PayloadValidator.validate(CoordinationMethod.REQUEST_DEVELOPER,
                json("{\"issueNumber\": 12, \"priority\": \"high\", \"requirements\": [\"tests\"]}")).valid());
    }

    @Test
    void memoryPayloadShapes() throws Exception {
        assertFalse(PayloadValidator.validate(CoordinationMethod.MEMORY_CREATE_ENTITY,
                json("{\"name\": \"X\", \"entityType\": \"Component\"}")).valid());
        assertTrue(PayloadValidator.validate(CoordinationMethod.MEMORY_CREATE_ENTITY,
                json("{\"name\": \"X\", \"entityType\": \"Component\", \"observations\": []}")).valid());
        assertFalse(PayloadValidator.validate(CoordinationMethod.MEMORY_UPDATE_ENTITY,
                json("{\"name\": \"X\", \"observations\": \"one\"}")).valid());
        assertFalse(PayloadValidator.validate(CoordinationMethod.MEMORY_SEARCH_ENTITIES, json("{\"limit\": 0}")).valid());
        assertFalse(PayloadValidator.validate(CoordinationMethod.MEMORY_CREATE_RELATION,
                json("{\"from\": \"a\", \"to\": \"b\", \"relationType\": \"supports\", \"strength\": \"high\"}")).valid());
    }

    @Test
    void parameterlessMethodsAcceptMissingParamsButNotArrays() throws Exception {
        assertTrue(PayloadValidator.validate(CoordinationMethod.GET_STATS, null).valid());
        assertTrue(PayloadValidator.validate(CoordinationMethod.LIST_INSTANCES, null).valid());
        ValidationResult array = PayloadValidator.validate(CoordinationMethod.GET_STATE, json("[1]"));
        assertEquals("params must be an object", array.message());
    }

    private static JsonNode json(String raw) throws Exception {
        return Jsons.mapper().readTree(raw);
    }
}
