package com.example.tutor.ragservice.dto;

import java.util.List;

public record DeleteChunksRequest(List<String> ids) {
}
