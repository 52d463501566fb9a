package com.chambua.pricing.controller;

import com.chambua.pricing.dto.RowFailureDTO;
import com.chambua.pricing.dto.StartUploadRequest;
import com.chambua.pricing.dto.UploadJobStatusDTO;
import com.chambua.pricing.model.FailureKind;
import com.chambua.pricing.model.UploadJob;
import com.chambua.pricing.service.PriceListCsvReader;
import com.chambua.pricing.service.PriceUploadCoordinator;
import com.chambua.pricing.service.UploadJobService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = PriceUploadController.class)
@Import(PriceListCsvReader.class)
@ActiveProfiles("test")
class PriceUploadControllerTest {

    @Autowired private MockMvc mockMvc;
    @MockBean private PriceUploadCoordinator coordinator;
    @MockBean private UploadJobService uploadJobService;

    private static UploadJob queued(long id, int rows) {
        UploadJob job = new UploadJob("prices.csv", LocalDate.of(2024, 3, 1), "u-1", rows);
        job.setId(id);
        return job;
    }

    @Test
    void jsonUploadIsAccepted() throws Exception {
        when(coordinator.submit(any(StartUploadRequest.class), eq("u-1"))).thenReturn(queued(5L, 2));

        mockMvc.perform(post("/api/price/uploads")
                        .header("X-User-Id", "u-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filename\":\"prices.csv\",\"observedDate\":\"2024-03-01\","
                                + "\"rows\":[{\"externalId\":\"A\",\"rawPrice\":100},{\"externalId\":\"B\",\"rawPrice\":2000,\"inStock\":false}]}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(5))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.totalRows").value(2));

        ArgumentCaptor<StartUploadRequest> captor = ArgumentCaptor.forClass(StartUploadRequest.class);
        verify(coordinator).submit(captor.capture(), eq("u-1"));
        assertThat(captor.getValue().getRows()).hasSize(2);
        assertThat(captor.getValue().getRows().get(1).inStock()).isFalse();
        assertThat(captor.getValue().getObservedDate()).isEqualTo(LocalDate.of(2024, 3, 1));
    }

    @Test
    void emptyBatchIsBadRequest() throws Exception {
        when(coordinator.submit(any(StartUploadRequest.class), any())).thenThrow(new IllegalArgumentException("Price list has no rows"));

        mockMvc.perform(post("/api/price/uploads")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filename\":\"empty.csv\",\"rows\":[]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void csvUploadIsParsedAndQueued() throws Exception {
        when(coordinator.submit(any(StartUploadRequest.class), any())).thenReturn(queued(6L, 2));
        MockMultipartFile file = new MockMultipartFile("file", "prices.csv", "text/csv",
                "article,name,price\nA,Dior Homme,100\nB,Kenzo,n/a\n".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/price/uploads/csv").file(file).param("observedDate", "2024-03-02"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(6));

        ArgumentCaptor<StartUploadRequest> captor = ArgumentCaptor.forClass(StartUploadRequest.class);
        verify(coordinator).submit(captor.capture(), any());
        StartUploadRequest request = captor.getValue();
        assertThat(request.getFilename()).isEqualTo("prices.csv");
        assertThat(request.getRows()).hasSize(2);
        assertThat(request.getRows().get(1).rawPrice()).isNull();
        assertThat(request.getRows().get(0).observedDate()).isEqualTo(LocalDate.of(2024, 3, 2));
    }

    @Test
    void csvWithoutPriceColumnIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "bad.csv", "text/csv",
                "article,name\nA,Dior\n".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/price/uploads/csv").file(file))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(coordinator);
    }

    @Test
    void unknownUploadIsNotFound() throws Exception {
        when(uploadJobService.get(99L)).thenReturn(Optional.empty());
        mockMvc.perform(get("/api/price/uploads/99")).andExpect(status().isNotFound());

        when(uploadJobService.failures(99L)).thenThrow(new NoSuchElementException("Upload 99 not found"));
        mockMvc.perform(get("/api/price/uploads/99/failures")).andExpect(status().isNotFound());
    }

    @Test
    void statusAndFailuresAreReturned() throws Exception {
        UploadJob job = queued(3L, 4);
        when(uploadJobService.get(3L)).thenReturn(Optional.of(UploadJobStatusDTO.from(job)));
        when(uploadJobService.failures(3L)).thenReturn(List.of(new RowFailureDTO(2, "X", FailureKind.VALIDATION, "No price for X")));

        mockMvc.perform(get("/api/price/uploads/3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.filename").value("prices.csv"))
                .andExpect(jsonPath("$.createdBy").value("u-1"));
        mockMvc.perform(get("/api/price/uploads/3/failures"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].rowIndex").value(2))
                .andExpect(jsonPath("$[0].kind").value("VALIDATION"));
    }

    @Test
    void cancellingFinishedUploadIsConflict() throws Exception {
        when(uploadJobService.cancel(4L)).thenThrow(new IllegalStateException("Upload 4 already DONE"));
        mockMvc.perform(post("/api/price/uploads/4/cancel")).andExpect(status().isConflict());

        when(uploadJobService.cancel(8L)).thenThrow(new NoSuchElementException("Upload 8 not found"));
        mockMvc.perform(post("/api/price/uploads/8/cancel")).andExpect(status().isNotFound());
    }
}
