package com.tradecodes.classifier.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import com.tradecodes.classifier.config.ClassifierProperties;
import com.tradecodes.classifier.model.Candidate;
import com.tradecodes.classifier.model.CandidateSource;
import com.tradecodes.classifier.model.MatchType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BedrockModelServiceTest {

    @Mock
    private BedrockRuntimeClient bedrockClient;

    private BedrockModelService service;

    @BeforeEach
    void setUp() {
        service = new BedrockModelService(bedrockClient, new ObjectMapper(), "chat-model", "embed-model",
                512, 2, RateLimiter.create(1000), RateLimiter.create(1000));
    }

    @Test
    void embeddingIsReadFromResponse() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class))).thenReturn(InvokeModelResponse.builder()
                .body(SdkBytes.fromUtf8String("{\"embedding\":[0.5,-0.25]}"))
                .build());

        assertThat(service.embed("steel bolts")).containsExactly(0.5f, -0.25f);
    }

    @Test
    void chatTimeoutSurfacesAsIOException() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenThrow(ApiCallTimeoutException.builder().message("call timed out").build());

        assertThatThrownBy(() -> service.invokeChatForText("prompt", 150))
                .isInstanceOf(IOException.class)
                .hasCauseInstanceOf(ApiCallTimeoutException.class);
    }

    @Test
    void embeddingConnectionFailureBecomesRetrievalFailure() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenThrow(SdkClientException.builder().message("Unable to execute HTTP request").build());

        assertThatThrownBy(() -> service.embed("steel bolts"))
                .isInstanceOf(RetrievalFailureException.class);
    }

    @Test
    void verificationTimeoutBecomesVerificationFailure() {
        when(bedrockClient.invokeModel(any(InvokeModelRequest.class)))
                .thenThrow(ApiCallTimeoutException.builder().message("call timed out").build());
        BedrockCompletionService completion = new BedrockCompletionService(service, new ClassifierProperties());
        Candidate bolts = new Candidate("7318.15.00", "Threaded bolts", 4.6, 0.46, MatchType.SEMANTIC,
                CandidateSource.SEMANTIC, List.of(), List.of(), List.of());

        assertThatThrownBy(() -> completion.verify("steel nuts and bolts", List.of(bolts)))
                .isInstanceOf(VerificationFailureException.class);
    }
}
