package com.edutrack.backend.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.edutrack.backend.TestStoreConfig;
import com.edutrack.backend.store.InMemoryDocumentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Student endpoints end to end, over the in-memory store.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestStoreConfig.class)
@DisplayName("Student API")
class StudentApiTest {

    private static final String TENANT_HEADER = "x-tenant-id";

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private InMemoryDocumentStore store;

    @BeforeEach
    void resetStore() {
        store.clear();
    }

    @Test
    @DisplayName("created student is listed with an id, the default status and no tenant field")
    void createThenList() throws Exception {
        mockMvc.perform(post("/students")
                        .header(TENANT_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("first_name", "Ana", "last_name", "Lee"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").isString())
                .andExpect(jsonPath("$.message").value("Student created"));

        mockMvc.perform(get("/students").header(TENANT_HEADER, "t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].id").isString())
                .andExpect(jsonPath("$[0].first_name").value("Ana"))
                .andExpect(jsonPath("$[0].status").value("active"))
                .andExpect(jsonPath("$[0].tenant_id").doesNotExist())
                .andExpect(jsonPath("$[0]._id").doesNotExist());
    }

    @Test
    @DisplayName("the resolved tenant is stored whatever the payload claims")
    void tenantFromPayloadIsIgnored() throws Exception {
        mockMvc.perform(post("/students")
                        .header(TENANT_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("first_name", "Ana", "last_name", "Lee", "tenant_id", "t2"))))
                .andExpect(status().isOk());

        assertThat(store.documents("student")).singleElement()
                .satisfies(doc -> assertThat(doc.get("tenant_id")).isEqualTo("t1"));
    }

    @Test
    @DisplayName("the header wins over the query parameter; the query alone is enough")
    void tenantSources() throws Exception {
        String id = createStudent("t1", "Ana");

        mockMvc.perform(get("/students").param("tenant_id", "t1"))
                .andExpect(jsonPath("$[0].id").value(id));
        mockMvc.perform(get("/students").header(TENANT_HEADER, "t2").param("tenant_id", "t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    @DisplayName("list honours the limit parameter")
    void listHonoursLimit() throws Exception {
        createStudent("t1", "Ana");
        createStudent("t1", "Ben");
        createStudent("t1", "Cy");

        mockMvc.perform(get("/students").header(TENANT_HEADER, "t1").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));
        mockMvc.perform(get("/students").header(TENANT_HEADER, "t1").param("limit", "-1"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/students").header(TENANT_HEADER, "t1").param("limit", "many"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    @DisplayName("partial update changes only the fields sent")
    void partialUpdate() throws Exception {
        Map<String, Object> body = new HashMap<>();
        body.put("first_name", "Ana");
        body.put("last_name", "Lee");
        body.put("grade", "4");
        body.put("email", "ana@school.example");
        body.put("class_ids", List.of("c1"));
        String id = create("t1", body);

        Map<String, Object> patch = new HashMap<>();
        patch.put("grade", "5");
        patch.put("email", null);
        mockMvc.perform(put("/students/{id}", id)
                        .header(TENANT_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(patch)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id))
                .andExpect(jsonPath("$.updated").value(true));

        Document stored = store.documents("student").get(0);
        assertThat(stored)
                .containsEntry("grade", "5")
                .containsEntry("email", "ana@school.example")
                .containsEntry("first_name", "Ana")
                .containsEntry("class_ids", List.of("c1"))
                .containsEntry("status", "active")
                .containsEntry("tenant_id", "t1");
    }

    @Test
    @DisplayName("another tenant can neither update nor delete the record")
    void crossTenantIsolation() throws Exception {
        String id = createStudent("t1", "Ana");

        mockMvc.perform(put("/students/{id}", id)
                        .header(TENANT_HEADER, "t2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("first_name", "Mallory"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
        mockMvc.perform(delete("/students/{id}", id).header(TENANT_HEADER, "t2"))
                .andExpect(status().isNotFound());

        assertThat(store.documents("student")).singleElement()
                .satisfies(doc -> assertThat(doc.get("first_name")).isEqualTo("Ana"));
    }

    @Test
    @DisplayName("delete removes the record permanently")
    void deleteRemoves() throws Exception {
        String id = createStudent("t1", "Ana");

        mockMvc.perform(delete("/students/{id}", id).header(TENANT_HEADER, "t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id))
                .andExpect(jsonPath("$.deleted").value(true));
        mockMvc.perform(delete("/students/{id}", id).header(TENANT_HEADER, "t1"))
                .andExpect(status().isNotFound());

        assertThat(store.documents("student")).isEmpty();
    }

    @Test
    @DisplayName("malformed ids are rejected with 400")
    void malformedIds() throws Exception {
        mockMvc.perform(put("/students/{id}", "abc")
                        .header(TENANT_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("grade", "5"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Invalid id: abc"));
        mockMvc.perform(delete("/students/{id}", "abc").header(TENANT_HEADER, "t1"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("unknown ids under the right tenant answer 404")
    void unknownId() throws Exception {
        mockMvc.perform(put("/students/{id}", new ObjectId().toHexString())
                        .header(TENANT_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("schema violations answer 422")
    void schemaViolations() throws Exception {
        mockMvc.perform(post("/students")
                        .header(TENANT_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("first_name", "Ana"))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail").value(containsString("lastName")));
        mockMvc.perform(post("/students")
                        .header(TENANT_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("first_name", "Ana", "last_name", "Lee", "status", "expelled"))))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(post("/students")
                        .header(TENANT_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("first_name", "Ana", "last_name", "Lee", "email", "not-an-email"))))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(post("/students")
                        .header(TENANT_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(post("/students")
                        .header(TENANT_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"first_name\":123,\"last_name\":\"Lee\"}"))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(post("/students")
                        .header(TENANT_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"first_name\":\"Ana\",\"last_name\":\"Lee\",\"class_ids\":[1,2]}"))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(post("/students")
                        .header(TENANT_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"first_name\":\"Ana\",\"last_name\":true,\"status\":0}"))
                .andExpect(status().isUnprocessableEntity());

        assertThat(store.documents("student")).isEmpty();
    }

    @Test
    @DisplayName("empty names are accepted but an empty email is not, on create and update")
    void emptyValues() throws Exception {
        String id = create("t1", Map.<String, Object>of("first_name", "", "last_name", "Lee"));

        mockMvc.perform(post("/students")
                        .header(TENANT_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("first_name", "Ana", "last_name", "Lee", "email", ""))))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(put("/students/{id}", id)
                        .header(TENANT_HEADER, "t1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("first_name", "", "email", ""))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail").value(containsString("email")));

        assertThat(store.documents("student")).singleElement().satisfies(doc -> {
            assertThat(doc.get("first_name")).isEqualTo("");
            assertThat(doc.get("email")).isNull();
        });
    }

    @Test
    @DisplayName("store outages answer 503 with the driver message")
    void storeOutage() throws Exception {
        store.failWith(new IllegalStateException("Timed out after 30000 ms while waiting for a server"));

        mockMvc.perform(get("/students").header(TENANT_HEADER, "t1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.detail").value("Database unavailable: Timed out after 30000 ms while waiting for a server"));
    }

    private String createStudent(String tenant, String firstName) throws Exception {
        return create(tenant, Map.<String, Object>of("first_name", firstName, "last_name", "Lee"));
    }

    private String create(String tenant, Map<String, Object> body) throws Exception {
        String response = mockMvc.perform(post("/students")
                        .header(TENANT_HEADER, tenant)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(body)))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return JsonPath.read(response, "$.id");
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }
}
