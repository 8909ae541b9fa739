package com.tabledesigner.api;

import com.tabledesigner.model.DesignSummary;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DesignsResponse {
    private boolean success;
    private List<DesignSummary> designs;
}
