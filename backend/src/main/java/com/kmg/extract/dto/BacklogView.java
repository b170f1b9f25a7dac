package com.kmg.extract.dto;

import com.kmg.extract.model.BacklogEntry;

import java.util.List;

public record BacklogView(String path, int count, List<BacklogEntry> items) {
}
