package io.github.jakubt4.doppler.dto;

import io.github.jakubt4.doppler.model.ComponentCurves;
import io.github.jakubt4.doppler.model.FitResult;

public record FitResponse(String status, String message, FitResult fit, ComponentCurves curves) {
}
