package com.tradecodes.classifier.service;

import com.tradecodes.classifier.config.ClassifierProperties;
import com.tradecodes.classifier.model.Candidate;
import com.tradecodes.classifier.model.CandidateSource;
import com.tradecodes.classifier.model.CompletionVerdict;
import com.tradecodes.classifier.model.MatchType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BedrockCompletionServiceTest {

    @Mock
    private BedrockModelService bedrockModelService;

    private BedrockCompletionService service;

    @BeforeEach
    void setUp() {
        service = new BedrockCompletionService(bedrockModelService, new ClassifierProperties());
    }

    @Test
    void parsesAllThreeLines() {
        CompletionVerdict verdict = BedrockCompletionService.parseVerdict(
                "CODE: 7318.15.00\nCONFIDENCE: 0.85\nREASONING: Threaded bolts of steel");

        assertThat(verdict.code()).isEqualTo("7318.15.00");
        assertThat(verdict.confidence()).isEqualTo(0.85);
        assertThat(verdict.reasoning()).isEqualTo("Threaded bolts of steel");
    }

    @Test
    void percentageConfidenceIsScaledDown() {
        CompletionVerdict verdict = BedrockCompletionService.parseVerdict("CODE: 0901.21\nCONFIDENCE: 90");

        assertThat(verdict.code()).isEqualTo("0901.21");
        assertThat(verdict.confidence()).isEqualTo(0.9);
        assertThat(verdict.reasoning()).isEqualTo("Model verified");
    }

    @Test
    void missingConfidenceUsesDefault() {
        assertThat(BedrockCompletionService.parseVerdict("CODE: 2101.11.10").confidence()).isEqualTo(0.7);
    }

    @Test
    void responseWithoutCodeIsRejected() {
        assertThatThrownBy(() -> BedrockCompletionService.parseVerdict("I am not sure which code applies."))
                .isInstanceOf(VerificationFailureException.class);
        assertThatThrownBy(() -> BedrockCompletionService.parseVerdict(null))
                .isInstanceOf(VerificationFailureException.class);
    }

    @Test
    void promptListsCandidatesWithSimilarity() {
        String prompt = service.buildPrompt("hex bolts", List.of(
                candidate("7318.15.00", "Bolts of iron or steel", 0.62),
                candidate("7318.16.00", "Nuts of iron or steel", 0.4)));

        assertThat(prompt).contains("\"hex bolts\"");
        assertThat(prompt).contains("1. 7318.15.00: Bolts of iron or steel (62.0%)");
        assertThat(prompt).contains("2. 7318.16.00: Nuts of iron or steel (40.0%)");
    }

    @Test
    void callFailureBecomesVerificationFailure() throws IOException {
        when(bedrockModelService.invokeChatForText(anyString(), eq(150))).thenThrow(new IOException("timeout"));

        assertThatThrownBy(() -> service.verify("hex bolts", List.of(candidate("7318.15.00", "Bolts", 0.6))))
                .isInstanceOf(VerificationFailureException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void clientTimeoutBecomesVerificationFailure() throws IOException {
        when(bedrockModelService.invokeChatForText(anyString(), eq(150)))
                .thenThrow(ApiCallTimeoutException.builder().message("call timed out").build());

        assertThatThrownBy(() -> service.verify("steel fasteners", List.of(candidate("7318.15.00", "Bolts", 0.5))))
                .isInstanceOf(VerificationFailureException.class)
                .hasCauseInstanceOf(ApiCallTimeoutException.class);
    }

    @Test
    void emptyShortlistIsRejectedWithoutCallingTheModel() {
        assertThatThrownBy(() -> service.verify("hex bolts", List.of()))
                .isInstanceOf(VerificationFailureException.class);
        verifyNoInteractions(bedrockModelService);
    }

    private static Candidate candidate(String code, String description, double similarity) {
        return new Candidate(code, description, similarity * 10, similarity, MatchType.SEMANTIC,
                CandidateSource.SEMANTIC, List.of(), List.of(), List.of());
    }
}
