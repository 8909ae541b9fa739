package com.tabledesigner.controller;

import com.tabledesigner.api.DatabaseStatusResponse;
import com.tabledesigner.api.DesignsResponse;
import com.tabledesigner.api.ExecuteSqlRequest;
import com.tabledesigner.api.ExecuteSqlResponse;
import com.tabledesigner.api.FieldRequest;
import com.tabledesigner.api.OperationResponse;
import com.tabledesigner.api.TableDesignRequest;
import com.tabledesigner.api.TableDetailResponse;
import com.tabledesigner.api.TablesResponse;
import com.tabledesigner.model.DesignRecord;
import com.tabledesigner.model.StatementResult;
import com.tabledesigner.model.TableDetail;
import com.tabledesigner.service.CatalogGateway;
import com.tabledesigner.service.SchemaInspector;
import com.tabledesigner.service.SchemaSynchronizer;
import com.tabledesigner.store.DesignStore;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api")
public class TableDesignerController {

    private static final Logger log = LoggerFactory.getLogger(TableDesignerController.class);

    private final SchemaSynchronizer schemaSynchronizer;
    private final SchemaInspector schemaInspector;
    private final CatalogGateway catalogGateway;
    private final DesignStore designStore;

    public TableDesignerController(
            SchemaSynchronizer schemaSynchronizer,
            SchemaInspector schemaInspector,
            CatalogGateway catalogGateway,
            DesignStore designStore
    ) {
        this.schemaSynchronizer = schemaSynchronizer;
        this.schemaInspector = schemaInspector;
        this.catalogGateway = catalogGateway;
        this.designStore = designStore;
    }

    /**
     * Create a table from a design. An existing table of the same name is rebuilt.
     *
     * POST /api/tables
     */
    @PostMapping("/tables")
    public ResponseEntity<OperationResponse> createTable(@Valid @RequestBody TableDesignRequest request) {
        DesignRecord record = schemaSynchronizer.createOrReplace(request.getTable());
        return ok("Table " + record.getTableName() + " created", record.getTableName(), record);
    }

    /**
     * Replace the whole design of an existing table. The table is rebuilt.
     *
     * PUT /api/tables/{name}
     */
    @PutMapping("/tables/{name}")
    public ResponseEntity<OperationResponse> updateTable(
            @PathVariable("name") String name,
            @Valid @RequestBody TableDesignRequest request
    ) {
        DesignRecord record = schemaSynchronizer.replace(name, request.getTable());
        return ok("Table " + name + " updated", name, record);
    }

    /**
     * DELETE /api/tables/{name}
     */
    @DeleteMapping("/tables/{name}")
    public ResponseEntity<OperationResponse> deleteTable(@PathVariable("name") String name) {
        schemaSynchronizer.drop(name);
        return ok("Table " + name + " deleted", name, null);
    }

    /**
     * Describe every table in the live database.
     *
     * GET /api/tables
     */
    @GetMapping("/tables")
    public ResponseEntity<TablesResponse> listTables() {
        return ResponseEntity.ok(new TablesResponse(true, schemaInspector.describeAll()));
    }

    /**
     * Live structure of one table with its recorded design, if any.
     *
     * GET /api/tables/{name}
     */
    @GetMapping("/tables/{name}")
    public ResponseEntity<TableDetailResponse> getTable(@PathVariable("name") String name) {
        TableDetail detail = schemaSynchronizer.detail(name);
        return ResponseEntity.ok(TableDetailResponse.builder()
                .success(true)
                .table(detail.getStructure())
                .design(detail.getDesign())
                .inSync(detail.isInSync())
                .build());
    }

    /**
     * POST /api/tables/{name}/fields
     */
    @PostMapping("/tables/{name}/fields")
    public ResponseEntity<OperationResponse> addField(
            @PathVariable("name") String name,
            @Valid @RequestBody FieldRequest request
    ) {
        Optional<DesignRecord> record = schemaSynchronizer.addField(name, request.getField());
        return ok("Field " + request.getField().getName() + " added", name, record.orElse(null));
    }

    /**
     * Replace a field definition. The table is rebuilt unless the change is a plain rename and the
     * in-place alteration mode is active.
     *
     * PUT /api/tables/{name}/fields/{fieldName}
     */
    @PutMapping("/tables/{name}/fields/{fieldName}")
    public ResponseEntity<OperationResponse> updateField(
            @PathVariable("name") String name,
            @PathVariable("fieldName") String fieldName,
            @Valid @RequestBody FieldRequest request
    ) {
        DesignRecord record = schemaSynchronizer.updateField(name, fieldName, request.getField());
        return ok("Field " + fieldName + " updated", name, record);
    }

    /**
     * DELETE /api/tables/{name}/fields/{fieldName}
     */
    @DeleteMapping("/tables/{name}/fields/{fieldName}")
    public ResponseEntity<OperationResponse> deleteField(
            @PathVariable("name") String name,
            @PathVariable("fieldName") String fieldName
    ) {
        DesignRecord record = schemaSynchronizer.removeField(name, fieldName);
        return ok("Field " + fieldName + " deleted", name, record);
    }

    /**
     * Rewrite the recorded design from the live table.
     *
     * POST /api/tables/{name}/reconcile
     */
    @PostMapping("/tables/{name}/reconcile")
    public ResponseEntity<OperationResponse> reconcile(@PathVariable("name") String name) {
        DesignRecord record = schemaSynchronizer.reconcile(name);
        return ok("Design of " + name + " reconciled with the live table", name, record);
    }

    /**
     * GET /api/designs
     */
    @GetMapping("/designs")
    public ResponseEntity<DesignsResponse> listDesigns() {
        return ResponseEntity.ok(new DesignsResponse(true, designStore.list()));
    }

    /**
     * Run one statement verbatim against the live database. Nothing is allow-listed.
     *
     * POST /api/execute-sql
     */
    @PostMapping("/execute-sql")
    public ResponseEntity<ExecuteSqlResponse> executeSql(@Valid @RequestBody ExecuteSqlRequest request) {
        log.info("Executing ad-hoc SQL: trace_id={}", MDC.get("trace_id"));
        StatementResult result = catalogGateway.execute(request.getSql());

        ExecuteSqlResponse response = new ExecuteSqlResponse();
        response.setSuccess(true);
        response.setDurationMs(result.getDurationMs());
        if (result.isTabular()) {
            response.setType("tabular");
            response.setColumns(result.getQueryResult().getColumns());
            response.setResults(result.getQueryResult().getRows());
            response.setTruncated(result.getQueryResult().isTruncated());
        } else {
            response.setType("text");
            response.setRowsAffected(result.getRowsAffected());
            response.setMessage("SQL executed successfully. Rows affected: " + result.getRowsAffected());
        }
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/database-status
     */
    @GetMapping("/database-status")
    public ResponseEntity<DatabaseStatusResponse> databaseStatus() {
        List<String> tables = catalogGateway.listTables();
        return ResponseEntity.ok(DatabaseStatusResponse.builder()
                .success(true)
                .tablesCount(tables.size())
                .tables(tables)
                .databaseSize(catalogGateway.sizeInBytes())
                .lastUpdated(OffsetDateTime.now())
                .build());
    }

    private ResponseEntity<OperationResponse> ok(String message, String table, DesignRecord record) {
        return ResponseEntity.ok(OperationResponse.builder()
                .success(true)
                .message(message)
                .table(table)
                .design(record)
                .build());
    }
}
