package com.decisionledger.signal.vision;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Face detector response. A non-null {@code error} means the image could
 * not be analysed.
 */
public record FaceDetection(
    @JsonProperty("faces_detected") int facesDetected,
    @JsonProperty("face_locations") List<List<Integer>> faceLocations,
    @JsonProperty("error") String error
) {

    public FaceDetection {
        faceLocations = faceLocations == null ? List.of() : List.copyOf(faceLocations);
    }
}
