package com.eyelevel.lotprocessor.service.result;

public enum InferencePhase {
    VISION,
    TRANSLATION
}
