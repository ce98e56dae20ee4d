package com.decisionledger.api;

import com.decisionledger.config.ProducerStatusReport;
import com.decisionledger.evaluation.EvaluationService;
import com.decisionledger.signal.EvaluationInput;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POST /api/v1/evaluate
 * POST /api/v1/evaluate/with-image (multipart)
 * GET  /api/v1/evaluate/health
 */
@RestController
@RequestMapping("/api/v1/evaluate")
public class EvaluateController {

    private final EvaluationService evaluationService;
    private final ProducerStatusReport producerStatus;

    public EvaluateController(EvaluationService evaluationService, ProducerStatusReport producerStatus) {
        this.evaluationService = evaluationService;
        this.producerStatus = producerStatus;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", "content evaluation");
        body.put("producers", producerStatus.producers());
        return body;
    }

    @PostMapping
    public EvaluateResponse evaluate(@RequestBody EvaluateRequest request) {
        if (request.input() == null) {
            throw new IllegalArgumentException("input is required");
        }
        EvaluationInput input = new EvaluationInput(
            request.input(), null, request.clientId(), request.user(), request.inputType());
        return EvaluateResponse.from(evaluationService.evaluate(input));
    }

    @PostMapping(value = "/with-image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public EvaluateResponse evaluateWithImage(@RequestParam("text") String text,
                                              @RequestParam(value = "client_id", required = false) String clientId,
                                              @RequestParam(value = "user", required = false) String user,
                                              @RequestPart(value = "image", required = false) MultipartFile image)
            throws IOException {
        byte[] imageBytes = image == null || image.isEmpty() ? null : image.getBytes();
        EvaluationInput input = new EvaluationInput(text, imageBytes, clientId, user, null);
        return EvaluateResponse.from(evaluationService.evaluate(input));
    }
}
