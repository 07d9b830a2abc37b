package io.github.jakubt4.doppler.model;

public record EpochFailure(int epoch, String reason) {
}
