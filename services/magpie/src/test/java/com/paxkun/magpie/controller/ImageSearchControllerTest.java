package com.paxkun.magpie.controller;

import com.paxkun.magpie.exception.ErrorCode;
import com.paxkun.magpie.exception.InvalidInputException;
import com.paxkun.magpie.exception.MagpieException;
import com.paxkun.magpie.exception.NoCandidatesFoundException;
import com.paxkun.magpie.service.ImageSearchService;
import com.paxkun.magpie.service.LoggerService;
import com.paxkun.magpie.service.api.ImageLink;
import com.paxkun.magpie.service.api.SearchImagesRequest;
import com.paxkun.magpie.service.api.SearchImagesResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.GsonHttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ImageSearchControllerTest {

    @Mock
    private ImageSearchService imageSearchService;

    @Mock
    private LoggerService loggerService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ImageSearchController(imageSearchService, loggerService))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new GsonHttpMessageConverter())
                .build();
    }

    @Test
    void searchReturnsSnakeCaseResponse() throws Exception {
        SearchImagesResponse response = SearchImagesResponse.builder()
                .success(true)
                .keyword("sunset")
                .requestedCount(3)
                .foundCount(3)
                .storedCount(2)
                .processingTimeMs(1200)
                .timings(new SearchImagesResponse.Timings(800, 400))
                .images(List.of(new ImageLink("https://img.example.com/images/sunset/a.jpg", "Sunset")))
                .timestamp("2024-06-10T12:00:00Z")
                .build();
        when(imageSearchService.searchAndStore(any(SearchImagesRequest.class))).thenReturn(response);

        mockMvc.perform(post("/api/search-images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"keyword\":\"sunset\",\"count\":3,\"watermark_text\":\"Magpie\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.stored_count").value(2))
                .andExpect(jsonPath("$.found_count").value(3))
                .andExpect(jsonPath("$.timings.search_ms").value(800))
                .andExpect(jsonPath("$.images[0].url").value("https://img.example.com/images/sunset/a.jpg"));

        ArgumentCaptor<SearchImagesRequest> request = ArgumentCaptor.forClass(SearchImagesRequest.class);
        verify(imageSearchService).searchAndStore(request.capture());
        assertThat(request.getValue().getKeyword().getAsString()).isEqualTo("sunset");
        assertThat(request.getValue().getCount().getAsInt()).isEqualTo(3);
        assertThat(request.getValue().getWatermarkText()).isEqualTo("Magpie");
    }

    @Test
    void validationErrorsAreBadRequest() throws Exception {
        when(imageSearchService.searchAndStore(any(SearchImagesRequest.class)))
                .thenThrow(new InvalidInputException(ErrorCode.KEYWORD_TOO_SHORT, "Keyword must be at least 2 characters long"));

        mockMvc.perform(post("/api/search-images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"keyword\":\"a\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("KEYWORD_TOO_SHORT"))
                .andExpect(jsonPath("$.processing_time_ms").isNumber());
    }

    @Test
    void noCandidatesIsNotFoundWithKeyword() throws Exception {
        when(imageSearchService.searchAndStore(any(SearchImagesRequest.class)))
                .thenThrow(new NoCandidatesFoundException("xyzzy", null));

        mockMvc.perform(post("/api/search-images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"keyword\":\"xyzzy\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NO_IMAGES_FOUND"))
                .andExpect(jsonPath("$.keyword").value("xyzzy"));
    }

    @Test
    void searchFailuresMapToTheirStatus() throws Exception {
        when(imageSearchService.searchAndStore(any(SearchImagesRequest.class)))
                .thenThrow(new MagpieException(ErrorCode.REQUEST_TIMEOUT, "timed out", "sunset", null))
                .thenThrow(new MagpieException(ErrorCode.NETWORK_ERROR, "refused", "sunset", null))
                .thenThrow(new MagpieException(ErrorCode.SEARCH_FAILED, "blocked", "sunset", null));

        mockMvc.perform(post("/api/search-images").contentType(MediaType.APPLICATION_JSON).content("{\"keyword\":\"sunset\"}"))
                .andExpect(status().isRequestTimeout());
        mockMvc.perform(post("/api/search-images").contentType(MediaType.APPLICATION_JSON).content("{\"keyword\":\"sunset\"}"))
                .andExpect(status().isServiceUnavailable());
        mockMvc.perform(post("/api/search-images").contentType(MediaType.APPLICATION_JSON).content("{\"keyword\":\"sunset\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("SEARCH_FAILED"));
    }

    @Test
    void unexpectedErrorIsInternalError() throws Exception {
        when(imageSearchService.searchAndStore(any(SearchImagesRequest.class)))
                .thenThrow(new IllegalStateException("bug"));

        mockMvc.perform(post("/api/search-images").contentType(MediaType.APPLICATION_JSON).content("{\"keyword\":\"sunset\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"));
    }

    @Test
    void malformedBodyIsInvalidRequest() throws Exception {
        mockMvc.perform(post("/api/search-images")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    void healthReportsOk() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.service").value("magpie"));
    }

    @Test
    void docsListEndpoints() throws Exception {
        mockMvc.perform(get("/api/docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.endpoints[0].path").value("/api/search-images"))
                .andExpect(jsonPath("$.endpoints[0].method").value("POST"));
    }

    @Test
    void unknownRouteIsJsonNotFound() throws Exception {
        mockMvc.perform(get("/api/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }
}
