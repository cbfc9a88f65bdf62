package com.cataphract.dto;

import com.cataphract.model.Message;

public record MessageDispatchResult(boolean success, String detail, Message message) {
}
