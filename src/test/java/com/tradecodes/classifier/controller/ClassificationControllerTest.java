package com.tradecodes.classifier.controller;

import com.tradecodes.classifier.model.ClassificationResponse;
import com.tradecodes.classifier.model.AnsweredQuestion;
import com.tradecodes.classifier.model.ClassificationResult;
import com.tradecodes.classifier.model.ConversationSnapshot;
import com.tradecodes.classifier.service.ClassificationDecisionEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ClassificationController.class)
class ClassificationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ClassificationDecisionEngine decisionEngine;

    @Test
    void classifyReturnsEngineResponse() throws Exception {
        ClassificationResult result = new ClassificationResult("7318.15.00", "Bolts of iron or steel", 90,
                "\"hex bolts\" → Bolts of iron or steel", List.of());
        when(decisionEngine.classify("hex bolts", null))
                .thenReturn(ClassificationResponse.classification("conv-1", result));

        mockMvc.perform(post("/api/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"hex bolts\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("CLASSIFICATION"))
                .andExpect(jsonPath("$.conversationId").value("conv-1"))
                .andExpect(jsonPath("$.result.code").value("7318.15.00"))
                .andExpect(jsonPath("$.result.confidence").value(90));
    }

    @Test
    void blankQueryIsRejected() throws Exception {
        mockMvc.perform(post("/api/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"   \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void engineFailureIsReportedAsServerError() throws Exception {
        when(decisionEngine.classify("hex bolts", null)).thenThrow(new IllegalStateException("rules not loaded"));

        mockMvc.perform(post("/api/classify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"hex bolts\"}"))
                .andExpect(status().isInternalServerError());
    }

    @Test
    void answerToExpiredConversationIsNotFound() throws Exception {
        when(decisionEngine.isActive("gone")).thenReturn(false);

        mockMvc.perform(post("/api/classify/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conversationId\":\"gone\",\"questionId\":\"chapter_1\",\"selectedOptionCode\":\"73\"}"))
                .andExpect(status().isNotFound());
        verify(decisionEngine, never()).answerQuestion(anyString(), anyString(), anyString());
    }

    @Test
    void answerWithoutQuestionIdIsRejected() throws Exception {
        mockMvc.perform(post("/api/classify/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conversationId\":\"conv-1\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void answerIsForwardedToEngine() throws Exception {
        when(decisionEngine.isActive("conv-1")).thenReturn(true);
        when(decisionEngine.answerQuestion("conv-1", "chapter_1", "73"))
                .thenReturn(ClassificationResponse.needMoreInfo("conv-1", "Please add detail"));

        mockMvc.perform(post("/api/classify/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conversationId\":\"conv-1\",\"questionId\":\"chapter_1\",\"selectedOptionCode\":\"73\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("NEED_MORE_INFO"))
                .andExpect(jsonPath("$.message").value("Please add detail"));
    }

    @Test
    void skipReturnsBestAvailableClassification() throws Exception {
        ClassificationResult result = new ClassificationResult("0901.21.10", "Coffee, roasted, not decaffeinated", 64,
                "\"coffee\" → Coffee, roasted. Best match at reduced confidence; verification was unavailable", List.of());
        when(decisionEngine.isActive("conv-1")).thenReturn(true);
        when(decisionEngine.skip("conv-1")).thenReturn(ClassificationResponse.classification("conv-1", result));

        mockMvc.perform(post("/api/classify/skip")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conversationId\":\"conv-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("CLASSIFICATION"))
                .andExpect(jsonPath("$.result.code").value("0901.21.10"))
                .andExpect(jsonPath("$.result.confidence").value(64));
    }

    @Test
    void skipWithoutConversationIdIsRejected() throws Exception {
        mockMvc.perform(post("/api/classify/skip")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
        verify(decisionEngine, never()).skip(anyString());
    }

    @Test
    void skipOnExpiredConversationIsNotFound() throws Exception {
        when(decisionEngine.isActive("gone")).thenReturn(false);

        mockMvc.perform(post("/api/classify/skip")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conversationId\":\"gone\"}"))
                .andExpect(status().isNotFound());
        verify(decisionEngine, never()).skip(anyString());
    }

    @Test
    void conversationStateIsReturned() throws Exception {
        ConversationSnapshot snapshot = new ConversationSnapshot("conv-1", "coffee", "coffee Coffee, tea, mate and spices",
                2, Instant.parse("2026-01-05T10:15:30Z"),
                List.of(new AnsweredQuestion("ambiguity_coffee", "09", "Coffee, tea, mate and spices", true)),
                List.of("heading_2"), List.of("09"), List.of("0901.11.10", "0901.21.10"));
        when(decisionEngine.describe("conv-1")).thenReturn(Optional.of(snapshot));

        mockMvc.perform(get("/api/classify/conv-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversationId").value("conv-1"))
                .andExpect(jsonPath("$.round").value(2))
                .andExpect(jsonPath("$.answeredQuestions[0].questionId").value("ambiguity_coffee"))
                .andExpect(jsonPath("$.pendingQuestionIds[0]").value("heading_2"))
                .andExpect(jsonPath("$.candidateCodes.length()").value(2));
    }

    @Test
    void unknownConversationStateIsNotFound() throws Exception {
        when(decisionEngine.describe("gone")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/classify/gone"))
                .andExpect(status().isNotFound());
    }

    @Test
    void deleteResetsConversation() throws Exception {
        mockMvc.perform(delete("/api/classify/conv-1"))
                .andExpect(status().isNoContent());
        verify(decisionEngine).reset("conv-1");
    }
}
