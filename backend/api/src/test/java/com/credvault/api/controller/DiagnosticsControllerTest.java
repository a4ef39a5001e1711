package com.credvault.api.controller;

import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.credvault.api.exception.StoreException;
import com.credvault.api.service.DiagnosticsService;
import com.credvault.api.store.DocumentStore;
import com.credvault.api.store.MongoConnectionProvider;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DiagnosticsController.class)
@Import(DiagnosticsService.class)
@TestPropertySource(properties = { "DATABASE_URL=mongodb://localhost:27017", "DATABASE_NAME=" })
class DiagnosticsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MongoConnectionProvider connectionProvider;

    @MockBean
    private DocumentStore documentStore;

    @Test
    void unconfiguredStoreStillAnswersOk() throws Exception {
        when(connectionProvider.template()).thenReturn(Optional.empty());

        mockMvc.perform(get("/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backend", containsString("Running")))
                .andExpect(jsonPath("$.database", containsString("Available but not initialized")))
                .andExpect(jsonPath("$.connection_status").value("Not Connected"))
                .andExpect(jsonPath("$.database_url", allOf(containsString("Set"), not(containsString("Not")))))
                .andExpect(jsonPath("$.database_name", containsString("Not Set")))
                .andExpect(jsonPath("$.collections", hasSize(0)));
    }

    @Test
    void unreachableStoreStillAnswersOk() throws Exception {
        when(connectionProvider.template()).thenReturn(Optional.of(mock(MongoTemplate.class)));
        when(documentStore.listCollectionNames(10)).thenThrow(new StoreException(
                "Timed out after 5000 ms while waiting to connect", null, StoreException.ErrorType.EXECUTION_ERROR));

        mockMvc.perform(get("/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.database", containsString("Connected but Error: Timed out")))
                .andExpect(jsonPath("$.connection_status").value("Connected"))
                .andExpect(jsonPath("$.collections", hasSize(0)));
    }

    @Test
    void workingStoreListsCollections() throws Exception {
        when(connectionProvider.template()).thenReturn(Optional.of(mock(MongoTemplate.class)));
        when(documentStore.listCollectionNames(10)).thenReturn(List.of("credential", "audit"));

        mockMvc.perform(get("/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.database", containsString("Connected & Working")))
                .andExpect(jsonPath("$.collections", hasSize(2)))
                .andExpect(jsonPath("$.collections[0]").value("credential"));
    }
}
