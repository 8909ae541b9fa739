package com.tabledesigner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Live structure of a table next to its recorded design, which is null for tables created outside
 * the designer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableDetail {
    private TableStructure structure;
    private TableDesign design;
    private boolean inSync;
}
