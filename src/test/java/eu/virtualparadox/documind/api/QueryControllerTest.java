package eu.virtualparadox.documind.api;

import eu.virtualparadox.documind.query.QueryManager;
import eu.virtualparadox.documind.query.model.QueryRequest;
import eu.virtualparadox.documind.query.model.QueryResult;
import eu.virtualparadox.documind.query.question.QuestionJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class QueryControllerTest {

    private final QueryManager queryManager = mock(QueryManager.class);

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new QueryController(queryManager))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("A query is answered synchronously")
    void query() throws Exception {
        when(queryManager.answer(eq("alice"), argThat(r -> "What is DocuMind?".equals(r.query()) && r.maxResults() == 3)))
                .thenReturn(new QueryResult("An assistant.", List.of(), 0.5, "q1", Instant.EPOCH, null, false, List.of()));

        mvc.perform(post("/api/query")
                        .header(ApiHeaders.OWNER_ID, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"What is DocuMind?\", \"maxResults\": 3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("An assistant."))
                .andExpect(jsonPath("$.confidence").value(0.5))
                .andExpect(jsonPath("$.queryId").value("q1"));
    }

    @Test
    @DisplayName("Invalid queries are bad requests")
    void invalidQuery() throws Exception {
        when(queryManager.answer(eq("alice"), any())).thenThrow(new IllegalArgumentException("query must not be blank"));

        mvc.perform(post("/api/query")
                        .header(ApiHeaders.OWNER_ID, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("query must not be blank"));
    }

    @Test
    @DisplayName("A blank owner header is rejected before any search runs")
    void blankOwner() throws Exception {
        mvc.perform(post("/api/query")
                        .header(ApiHeaders.OWNER_ID, "")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"secret salary\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"));

        mvc.perform(post("/api/query/jobs")
                        .header(ApiHeaders.OWNER_ID, "  ")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"secret salary\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(queryManager);
    }

    @Test
    @DisplayName("Submitted jobs are accepted and visible only to their owner")
    void jobs() throws Exception {
        QuestionJob job = new QuestionJob(7, "alice", QueryRequest.of("q"));
        when(queryManager.submitQuery(eq("alice"), any())).thenReturn(job);
        when(queryManager.getJob(7)).thenReturn(Optional.of(job));

        mvc.perform(post("/api/query/jobs")
                        .header(ApiHeaders.OWNER_ID, "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"q\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.status").value("QUEUED"));

        mvc.perform(get("/api/query/jobs/7").header(ApiHeaders.OWNER_ID, "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query").value("q"));
        mvc.perform(get("/api/query/jobs/7").header(ApiHeaders.OWNER_ID, "bob"))
                .andExpect(status().isNotFound());
        mvc.perform(delete("/api/query/jobs/7").header(ApiHeaders.OWNER_ID, "bob"))
                .andExpect(status().isNotFound());

        verify(queryManager, never()).cancel(anyLong());

        mvc.perform(delete("/api/query/jobs/7").header(ApiHeaders.OWNER_ID, "alice"))
                .andExpect(status().isOk());
        verify(queryManager).cancel(7);
    }
}
