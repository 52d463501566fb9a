package com.chambua.pricing.controller;

import com.chambua.pricing.dto.HistoryEntryDTO;
import com.chambua.pricing.dto.ProductPriceDTO;
import com.chambua.pricing.dto.SearchHitDTO;
import com.chambua.pricing.dto.SearchPageDTO;
import com.chambua.pricing.model.ChangeType;
import com.chambua.pricing.service.CatalogQueryService;
import com.chambua.pricing.service.CatalogSearchService;
import com.chambua.pricing.service.PriceUploadCoordinator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = CatalogController.class)
@ActiveProfiles("test")
class CatalogControllerTest {

    @Autowired private MockMvc mockMvc;
    @MockBean private CatalogQueryService queryService;
    @MockBean private CatalogSearchService searchService;
    @MockBean private PriceUploadCoordinator coordinator;

    @Test
    void productPriceIsReturned() throws Exception {
        when(queryService.currentPrice("A")).thenReturn(Optional.of(new ProductPriceDTO("A", "Dior", "Sauvage",
                "Парфюм", new BigDecimal("100.00"), "мл", "M",
                new BigDecimal("130.00"), new BigDecimal("150.00"), new BigDecimal("20.00"), true, true, true, null)));

        mockMvc.perform(get("/api/price/products/A"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quotedPrice").value(150.00))
                .andExpect(jsonPath("$.roundDelta").value(20.00))
                .andExpect(jsonPath("$.category").value("Парфюм"))
                .andExpect(jsonPath("$.gender").value("M"));
    }

    @Test
    void unknownProductIsNotFound() throws Exception {
        when(queryService.currentPrice("nope")).thenReturn(Optional.empty());
        when(queryService.history("nope")).thenThrow(new NoSuchElementException("Product nope not found"));

        mockMvc.perform(get("/api/price/products/nope")).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/price/products/nope/history")).andExpect(status().isNotFound());
    }

    @Test
    void historyIsNewestFirst() throws Exception {
        when(queryService.history("A")).thenReturn(List.of(
                new HistoryEntryDTO(2L, 11L, ChangeType.INCREASED, new BigDecimal("100"), new BigDecimal("130"),
                        new BigDecimal("100"), new BigDecimal("150"), BigDecimal.ZERO, new BigDecimal("20"), "RUB", LocalDate.of(2024, 4, 2), null),
                new HistoryEntryDTO(1L, 10L, ChangeType.NEW, null, new BigDecimal("100"),
                        null, new BigDecimal("100"), null, BigDecimal.ZERO, "RUB", LocalDate.of(2024, 4, 1), null)));

        mockMvc.perform(get("/api/price/products/A/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].changeType").value("INCREASED"))
                .andExpect(jsonPath("$[1].changeType").value("NEW"));
    }

    @Test
    void searchForwardsQueryAndPaging() throws Exception {
        when(searchService.search("dior sauvage", 11L, 1, 20)).thenReturn(new SearchPageDTO(
                List.of(new SearchHitDTO("A", "Dior", "Sauvage", "Dior Sauvage 100 ml", new BigDecimal("150"), true)), 21, 1, 20));

        mockMvc.perform(get("/api/price/search")
                        .param("q", "dior sauvage")
                        .param("uploadId", "11")
                        .param("page", "1")
                        .param("size", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(21))
                .andExpect(jsonPath("$.items[0].externalId").value("A"));
    }

    @Test
    void rebuildIsQueuedAndReportsIndexedCount() throws Exception {
        when(coordinator.rebuildSearchIndex()).thenReturn(CompletableFuture.completedFuture(42L));

        MvcResult queued = mockMvc.perform(post("/api/price/search-index/rebuild"))
                .andExpect(request().asyncStarted())
                .andReturn();
        mockMvc.perform(asyncDispatch(queued))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.indexed").value(42));
    }

    @Test
    void rebuildWithFullQueueIsUnavailable() throws Exception {
        when(coordinator.rebuildSearchIndex()).thenThrow(new TaskRejectedException("queue full"));
        mockMvc.perform(post("/api/price/search-index/rebuild"))
                .andExpect(status().isServiceUnavailable());
    }
}
