package com.acme.workplan;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

public class WorkItemIntegrationTest extends IntegrationTestBase {

    @Test
    void siblingsGetGappedOrderIndexes() throws Exception {
        String projectId = newProject();
        JsonNode p = createItem(projectId, "project", "P", null);
        assertEquals(1.0, p.get("orderIndex").asDouble());
        assertEquals("not_started", p.get("status").asText());

        long pid = p.get("id").asLong();
        assertEquals(1.0, createItem(projectId, "task", "first", pid).get("orderIndex").asDouble());
        assertEquals(11.0, createItem(projectId, "task", "second", pid).get("orderIndex").asDouble());
        assertEquals(21.0, createItem(projectId, "phase", "third", pid).get("orderIndex").asDouble());
    }

    @Test
    void parentFromAnotherProjectIsRejected() throws Exception {
        String mine = newProject();
        String other = newProject();
        long foreign = createItem(other, "project", "Other", null).get("id").asLong();

        mvc.perform(post("/api/projects/" + mine + "/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"phase\",\"title\":\"Sneaky\",\"parentId\":" + foreign + "}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.reason").value("cross-project"));
    }

    @Test
    void unknownParentIsNotFound() throws Exception {
        String projectId = newProject();
        mvc.perform(post("/api/projects/" + projectId + "/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"task\",\"title\":\"Lost\",\"parentId\":987654321}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void topLevelTaskAndMissingTitleAreRejected() throws Exception {
        String projectId = newProject();
        mvc.perform(post("/api/projects/" + projectId + "/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"task\",\"title\":\"Floating\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.reason").value("bad-nesting"));
        mvc.perform(post("/api/projects/" + projectId + "/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"project\",\"title\":\" \"}"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/projects/" + projectId + "/items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"epic\",\"title\":\"Unknown type\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void itemsAreInvisibleFromOtherProjects() throws Exception {
        String mine = newProject();
        String other = newProject();
        long id = createItem(mine, "project", "Mine", null).get("id").asLong();

        mvc.perform(get("/api/projects/" + other + "/items/" + id)).andExpect(status().isNotFound());
        mvc.perform(patch("/api/projects/" + other + "/items/" + id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Hijacked\"}"))
                .andExpect(status().isNotFound());
        mvc.perform(post("/api/projects/" + other + "/items/" + id + "/complete")).andExpect(status().isNotFound());

        mvc.perform(get("/api/projects/" + mine + "/items/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("Mine"));
    }

    @Test
    void immutableFieldsCannotBeUpdated() throws Exception {
        String projectId = newProject();
        String other = newProject();
        long id = createItem(projectId, "project", "P", null).get("id").asLong();

        mvc.perform(patch("/api/projects/" + projectId + "/items/" + id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"task\"}"))
                .andExpect(status().isBadRequest());
        mvc.perform(patch("/api/projects/" + projectId + "/items/" + id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Renamed\",\"projectId\":\"" + other + "\"}"))
                .andExpect(status().isBadRequest());
        mvc.perform(patch("/api/projects/" + projectId + "/items/" + id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":42}"))
                .andExpect(status().isBadRequest());

        JsonNode item = getJson("/api/projects/" + projectId + "/items/" + id);
        assertEquals(id, item.get("id").asLong());
        assertEquals("project", item.get("type").asText());
        assertEquals(projectId, item.get("projectId").asText());
        assertEquals("P", item.get("title").asText());
        assertEquals(1, getJson("/api/projects/" + projectId + "/items/" + id + "/changelog").size());
    }

    @Test
    void unreadableBodyGetsFixedMessage() throws Exception {
        String projectId = newProject();
        long id = createItem(projectId, "project", "P", null).get("id").asLong();

        mvc.perform(patch("/api/projects/" + projectId + "/items/" + id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.message").value("Malformed request body: expected a JSON object with only the documented fields"));
    }

    @Test
    void everyChangedFieldIsLoggedOnce() throws Exception {
        String projectId = newProject();
        long id = createItem(projectId, "project", "P", null).get("id").asLong();

        mvc.perform(patch("/api/projects/" + projectId + "/items/" + id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"P2\",\"notes\":\"kickoff done\",\"status\":\"not_started\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.title").value("P2"))
                .andExpect(jsonPath("$.notes").value("kickoff done"));

        JsonNode log = getJson("/api/projects/" + projectId + "/items/" + id + "/changelog");
        assertEquals(3, log.size());
        assertEquals("create", log.get(0).get("action").asText());
        assertEquals("field-change", log.get(1).get("action").asText());
        assertEquals("title", log.get(1).get("details").get("field").asText());
        assertEquals("P", log.get(1).get("details").get("old").asText());
        assertEquals("P2", log.get(1).get("details").get("new").asText());
        assertEquals("notes", log.get(2).get("details").get("field").asText());
        assertTrue(log.get(2).get("details").get("old").isNull());
    }

    @Test
    void completeIsLoggedOnceAndIsIdempotent() throws Exception {
        String projectId = newProject();
        long p = createItem(projectId, "project", "P", null).get("id").asLong();
        long task = createItem(projectId, "task", "T", p).get("id").asLong();

        complete(projectId, task);
        complete(projectId, task);

        JsonNode log = getJson("/api/projects/" + projectId + "/items/" + task + "/changelog");
        assertEquals(2, log.size());
        assertEquals("complete", log.get(1).get("action").asText());
        assertEquals("not_started", log.get(1).get("details").get("from").asText());
    }

    @Test
    void completedItemsCanOnlyBeReopened() throws Exception {
        String projectId = newProject();
        long p = createItem(projectId, "project", "P", null).get("id").asLong();
        long task = createItem(projectId, "task", "T", p).get("id").asLong();
        complete(projectId, task);

        mvc.perform(patch("/api/projects/" + projectId + "/items/" + task)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"not_started\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
        mvc.perform(patch("/api/projects/" + projectId + "/items/" + task)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"in_progress\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("in_progress"));
    }

    @Test
    void movingRevalidatesHierarchy() throws Exception {
        String projectId = newProject();
        long p = createItem(projectId, "project", "P", null).get("id").asLong();
        long design = createItem(projectId, "phase", "Design", p).get("id").asLong();
        long build = createItem(projectId, "phase", "Build", p).get("id").asLong();
        long task = createItem(projectId, "task", "Wireframes", design).get("id").asLong();
        long subtask = createItem(projectId, "subtask", "Header", task).get("id").asLong();

        mvc.perform(patch("/api/projects/" + projectId + "/items/" + task)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"parentId\":" + subtask + "}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.reason").value("bad-nesting"));

        mvc.perform(patch("/api/projects/" + projectId + "/items/" + task)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"parentId\":" + build + "}"))
                .andExpect(status().isOk());

        JsonNode log = getJson("/api/projects/" + projectId + "/items/" + task + "/changelog");
        assertEquals(2, log.size());
        assertEquals("update", log.get(1).get("action").asText());
        assertEquals(design, log.get(1).get("details").get("old").asLong());
        assertEquals(build, log.get(1).get("details").get("new").asLong());

        JsonNode plan = getJson("/api/projects/" + projectId + "/plan");
        JsonNode phases = plan.get("projects").get(0).get("children");
        assertEquals(0, phases.get(0).get("children").size());
        assertEquals("Wireframes", phases.get(1).get("children").get(0).get("title").asText());
    }

    @Test
    void emptyUpdateIsRejected() throws Exception {
        String projectId = newProject();
        long id = createItem(projectId, "project", "P", null).get("id").asLong();
        mvc.perform(patch("/api/projects/" + projectId + "/items/" + id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void listCanFilterByStatus() throws Exception {
        String projectId = newProject();
        long p = createItem(projectId, "project", "P", null).get("id").asLong();
        long done = createItem(projectId, "task", "Done", p).get("id").asLong();
        createItem(projectId, "task", "Open", p);
        complete(projectId, done);

        assertEquals(3, getJson("/api/projects/" + projectId + "/items").size());
        JsonNode open = getJson("/api/projects/" + projectId + "/items?status=not_started,in_progress");
        assertEquals(2, open.size());
        JsonNode completed = getJson("/api/projects/" + projectId + "/items?status=completed");
        assertEquals(1, completed.size());
        assertEquals(done, completed.get(0).get("id").asLong());
    }

    @Test
    void projectChangelogIsOrderedAndCapped() throws Exception {
        String projectId = newProject();
        long p = createItem(projectId, "project", "P", null).get("id").asLong();
        createItem(projectId, "phase", "One", p);
        createItem(projectId, "phase", "Two", p);
        createItem(projectId, "phase", "Three", p);

        JsonNode all = getJson("/api/projects/" + projectId + "/changelog");
        assertEquals(4, all.size());
        assertEquals("P", all.get(0).get("details").get("title").asText());

        // test profile caps the limit at 3: the latest three, oldest first
        JsonNode latest = getJson("/api/projects/" + projectId + "/changelog?limit=10");
        assertEquals(3, latest.size());
        assertEquals("One", latest.get(0).get("details").get("title").asText());
        assertEquals("Three", latest.get(2).get("details").get("title").asText());
    }
}
