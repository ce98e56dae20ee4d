package com.decisionledger.signal;

import java.util.Objects;
import java.util.Optional;

/**
 * Content handed to every signal producer for one evaluation.
 */
public record EvaluationInput(
    String text,
    byte[] image,
    String clientId,
    String user,
    String inputType
) {

    public EvaluationInput {
        text = Objects.requireNonNullElse(text, "");
        clientId = clientId == null || clientId.isBlank() ? "default" : clientId;
        user = user == null || user.isBlank() ? "anonymous" : user;
        if (inputType == null || inputType.isBlank()) {
            inputType = image != null && image.length > 0 ? "text_with_image" : "text";
        }
    }

    public static EvaluationInput text(String text, String clientId, String user) {
        return new EvaluationInput(text, null, clientId, user, "text");
    }

    public Optional<byte[]> imageData() {
        return image == null || image.length == 0 ? Optional.empty() : Optional.of(image);
    }
}
