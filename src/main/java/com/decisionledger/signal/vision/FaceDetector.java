package com.decisionledger.signal.vision;

import java.time.Duration;

/**
 * Counts faces in an image. May throw on transport errors or timeout.
 */
public interface FaceDetector {

    FaceDetection detect(byte[] image, Duration timeout);
}
