package com.example.fbp.dto;

public record QualityMetrics(double mse, double psnr, double ssim) {
}
