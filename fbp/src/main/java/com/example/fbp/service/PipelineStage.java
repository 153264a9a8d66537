package com.example.fbp.service;

public enum PipelineStage {
    IDLE,
    PREPROCESSING,
    FILTERING,
    BACK_PROJECTING,
    EVALUATING,
    DONE,
    FAILED,
    CANCELLED
}
