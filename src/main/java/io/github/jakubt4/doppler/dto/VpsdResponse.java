package io.github.jakubt4.doppler.dto;

import io.github.jakubt4.doppler.model.Vpsd;

public record VpsdResponse(String status, String message, Vpsd vpsd) {
}
