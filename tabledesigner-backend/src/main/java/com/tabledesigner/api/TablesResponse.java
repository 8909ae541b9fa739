package com.tabledesigner.api;

import com.tabledesigner.model.TableStructure;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TablesResponse {
    private boolean success;
    private List<TableStructure> tables;
}
