package com.yunhwan.queue.pause.app.api.pause.dto;

public record ErrorResponse(String error, String message) {
}
