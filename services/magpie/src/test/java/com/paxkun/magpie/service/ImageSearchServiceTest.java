package com.paxkun.magpie.service;

import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;
import com.paxkun.magpie.exception.AllStorageFailedException;
import com.paxkun.magpie.exception.ErrorCode;
import com.paxkun.magpie.exception.ExhaustedRetriesException;
import com.paxkun.magpie.exception.InvalidInputException;
import com.paxkun.magpie.exception.MagpieException;
import com.paxkun.magpie.exception.NoCandidatesFoundException;
import com.paxkun.magpie.exception.NoResultsException;
import com.paxkun.magpie.exception.SearchNetworkException;
import com.paxkun.magpie.service.api.SearchImagesRequest;
import com.paxkun.magpie.service.api.SearchImagesResponse;
import com.paxkun.magpie.service.pipeline.ImagePipeline;
import com.paxkun.magpie.service.pipeline.StoredImage;
import com.paxkun.magpie.service.search.SearchCandidate;
import com.paxkun.magpie.service.search.SearchOrchestrator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ImageSearchServiceTest {

    private static final List<SearchCandidate> CANDIDATES = List.of(
            new SearchCandidate("https://cdn.example.com/1.jpg", "https://example.com/1", "one"),
            new SearchCandidate("https://cdn.example.com/2.jpg", "https://example.com/2", "two"),
            new SearchCandidate("https://cdn.example.com/3.jpg", "https://example.com/3", "three"));

    @Mock
    private SearchOrchestrator searchOrchestrator;

    @Mock
    private ImagePipeline imagePipeline;

    @Mock
    private LoggerService loggerService;

    @InjectMocks
    private ImageSearchService imageSearchService;

    @Test
    void returnsStoredImagesWithCountsAndTimings() {
        Deque<Long> clock = new ArrayDeque<>(List.of(1_000L, 1_400L, 2_100L));
        imageSearchService.setCurrentTimeSupplier(clock::pop);
        when(searchOrchestrator.searchImages("sunset", 3)).thenReturn(CANDIDATES);
        when(imagePipeline.process(CANDIDATES, "sunset", "Magpie")).thenReturn(List.of(
                new StoredImage("https://img.example.com/images/sunset/a.jpg", "one", "https://example.com/1", "https://cdn.example.com/1.jpg"),
                new StoredImage("https://img.example.com/images/sunset/c.jpg", "three", "https://example.com/3", "https://cdn.example.com/3.jpg")));

        SearchImagesResponse response = imageSearchService.searchAndStore("  sunset ", null, "Magpie");

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getKeyword()).isEqualTo("sunset");
        assertThat(response.getRequestedCount()).isEqualTo(3);
        assertThat(response.getFoundCount()).isEqualTo(3);
        assertThat(response.getStoredCount()).isEqualTo(2);
        assertThat(response.getProcessingTimeMs()).isEqualTo(1_100L);
        assertThat(response.getTimings().getSearchMs()).isEqualTo(400L);
        assertThat(response.getTimings().getPipelineMs()).isEqualTo(700L);
        assertThat(response.getImages()).extracting("title").containsExactly("one", "three");
        assertThat(response.getTimestamp()).isEqualTo("1970-01-01T00:00:02.100Z");
    }

    @Test
    void rejectsMissingKeyword() {
        InvalidInputException e = catchThrowableOfType(
                () -> imageSearchService.searchAndStore((String) null, 3, null), InvalidInputException.class);

        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_KEYWORD);
        verifyNoInteractions(searchOrchestrator, imagePipeline);
    }

    @Test
    void rejectsShortKeywordAfterTrimming() {
        InvalidInputException e = catchThrowableOfType(
                () -> imageSearchService.searchAndStore("  a  ", 3, null), InvalidInputException.class);

        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.KEYWORD_TOO_SHORT);
    }

    @Test
    void rejectsCountOutsideRange() {
        assertThat(catchThrowableOfType(() -> imageSearchService.searchAndStore("sunset", 0, null),
                InvalidInputException.class).getErrorCode()).isEqualTo(ErrorCode.INVALID_COUNT);
        assertThat(catchThrowableOfType(() -> imageSearchService.searchAndStore("sunset", 11, null),
                InvalidInputException.class).getErrorCode()).isEqualTo(ErrorCode.INVALID_COUNT);
        verifyNoInteractions(searchOrchestrator);
    }

    @Test
    void nonStringKeywordIsInvalid() {
        SearchImagesRequest request = new SearchImagesRequest(new JsonPrimitive(42), null, null);

        InvalidInputException e = catchThrowableOfType(
                () -> imageSearchService.searchAndStore(request), InvalidInputException.class);

        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.INVALID_KEYWORD);
    }

    @Test
    void fractionalOrTextualCountIsInvalid() {
        SearchImagesRequest fractional = new SearchImagesRequest(new JsonPrimitive("sunset"), new JsonPrimitive(2.5), null);
        SearchImagesRequest textual = new SearchImagesRequest(new JsonPrimitive("sunset"), new JsonPrimitive("three"), null);

        assertThat(catchThrowableOfType(() -> imageSearchService.searchAndStore(fractional),
                InvalidInputException.class).getErrorCode()).isEqualTo(ErrorCode.INVALID_COUNT);
        assertThat(catchThrowableOfType(() -> imageSearchService.searchAndStore(textual),
                InvalidInputException.class).getErrorCode()).isEqualTo(ErrorCode.INVALID_COUNT);
    }

    @Test
    void nullCountDefaultsToThree() {
        when(searchOrchestrator.searchImages(anyString(), anyInt())).thenReturn(CANDIDATES);
        when(imagePipeline.process(CANDIDATES, "sunset", null)).thenReturn(List.of(
                new StoredImage("u", "one", "s", "o")));

        imageSearchService.searchAndStore(new SearchImagesRequest(new JsonPrimitive("sunset"), JsonNull.INSTANCE, null));

        verify(searchOrchestrator).searchImages("sunset", 3);
    }

    @Test
    void exhaustedWithoutResultsBecomesNoCandidatesFound() {
        when(searchOrchestrator.searchImages(anyString(), anyInt()))
                .thenThrow(new ExhaustedRetriesException(2, List.of(new NoResultsException("none"))));

        NoCandidatesFoundException e = catchThrowableOfType(
                () -> imageSearchService.searchAndStore("sunset", 3, null), NoCandidatesFoundException.class);

        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.NO_IMAGES_FOUND);
        assertThat(e.getKeyword()).isEqualTo("sunset");
        verifyNoInteractions(imagePipeline);
    }

    @Test
    void exhaustedByTimeoutKeepsTimeoutClassification() {
        when(searchOrchestrator.searchImages(anyString(), anyInt()))
                .thenThrow(new ExhaustedRetriesException(3, List.of(new SearchNetworkException("slow", null, true))));

        MagpieException e = catchThrowableOfType(
                () -> imageSearchService.searchAndStore("sunset", 3, null), MagpieException.class);

        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.REQUEST_TIMEOUT);
        assertThat(e.getKeyword()).isEqualTo("sunset");
        assertThat(e.getCause()).isInstanceOf(ExhaustedRetriesException.class);
    }

    @Test
    void nothingStoredIsAllStorageFailed() {
        when(searchOrchestrator.searchImages("sunset", 3)).thenReturn(CANDIDATES);
        when(imagePipeline.process(eq(CANDIDATES), eq("sunset"), org.mockito.ArgumentMatchers.isNull())).thenReturn(List.of());

        AllStorageFailedException e = catchThrowableOfType(
                () -> imageSearchService.searchAndStore("sunset", 3, null), AllStorageFailedException.class);

        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.UPLOAD_FAILED);
        assertThat(e.getMessage()).contains("3");
    }
}
