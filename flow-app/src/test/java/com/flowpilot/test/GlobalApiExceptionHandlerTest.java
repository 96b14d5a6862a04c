package com.flowpilot.test;

import com.flowpilot.api.response.Response;
import com.flowpilot.domain.tool.model.exception.ToolExecutionException;
import com.flowpilot.trigger.http.GlobalApiExceptionHandler;
import com.flowpilot.types.enums.ResponseCode;
import com.flowpilot.types.exception.AppException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class GlobalApiExceptionHandlerTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new ErrorController())
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
    }

    @Test
    public void shouldMapBusinessErrorToBadRequest() throws Exception {
        mockMvc.perform(get("/api/test/not-pending"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ResponseCode.RUN_NOT_PENDING.getCode()))
                .andExpect(jsonPath("$.info").value("Run is not waiting for user input (status: completed)"));
    }

    @Test
    public void shouldMapMissingRunToNotFound() throws Exception {
        mockMvc.perform(get("/api/test/not-found"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ResponseCode.RUN_NOT_FOUND.getCode()));
    }

    @Test
    public void shouldMapMissingProviderToServiceUnavailable() throws Exception {
        mockMvc.perform(get("/api/test/no-llm"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.info").value("No LLM provider configured"));
    }

    @Test
    public void shouldExposeToolFailureMessage() throws Exception {
        mockMvc.perform(get("/api/test/tool-error"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value(ResponseCode.UN_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value("http_get: connection refused"));
    }

    @Test
    public void shouldHideUnknownExceptionDetails() throws Exception {
        mockMvc.perform(get("/api/test/runtime-error"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value(ResponseCode.UN_ERROR.getCode()))
                .andExpect(jsonPath("$.info").value(ResponseCode.UN_ERROR.getInfo()));
    }

    @Test
    public void shouldHandleTypeMismatchExceptionAsIllegalParameter() throws Exception {
        mockMvc.perform(get("/api/test/type-error/not-number"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ResponseCode.ILLEGAL_PARAMETER.getCode()));
    }

    @RestController
    private static class ErrorController {

        @GetMapping("/api/test/not-pending")
        public Response<Void> notPending() {
            throw new AppException(ResponseCode.RUN_NOT_PENDING.getCode(),
                    "Run is not waiting for user input (status: completed)");
        }

        @GetMapping("/api/test/not-found")
        public Response<Void> notFound() {
            throw new AppException(ResponseCode.RUN_NOT_FOUND.getCode(), "Run not found");
        }

        @GetMapping("/api/test/no-llm")
        public Response<Void> noLlm() {
            throw new AppException(ResponseCode.LLM_UNAVAILABLE.getCode(), "No LLM provider configured");
        }

        @GetMapping("/api/test/tool-error")
        public Response<Void> toolError() {
            throw new ToolExecutionException("http_get", new IllegalStateException("connection refused"));
        }

        @GetMapping("/api/test/runtime-error")
        public Response<Void> runtimeError() {
            throw new RuntimeException("boom");
        }

        @GetMapping("/api/test/type-error/{id}")
        public Response<String> typeError(@PathVariable("id") Long id) {
            return Response.<String>builder()
                    .code(ResponseCode.SUCCESS.getCode())
                    .info(ResponseCode.SUCCESS.getInfo())
                    .data(String.valueOf(id))
                    .build();
        }
    }
}
