package com.adforge.core.fanout;

import com.adforge.core.error.ItemProcessingException;

public record ItemFailure(String itemId, ItemProcessingException error) {

    public String message() {
        return error.getMessage();
    }
}
