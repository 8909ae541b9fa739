package com.tabledesigner.service;

import com.tabledesigner.config.DesignerSettings;
import com.tabledesigner.ddl.DdlBuilder;
import com.tabledesigner.ddl.SqlLiterals;
import com.tabledesigner.error.DesignNotFoundException;
import com.tabledesigner.error.DesignPersistenceFailedException;
import com.tabledesigner.error.DuplicateFieldException;
import com.tabledesigner.error.FieldNotFoundException;
import com.tabledesigner.error.InvalidDesignException;
import com.tabledesigner.error.TableNotFoundException;
import com.tabledesigner.model.ColumnInfo;
import com.tabledesigner.model.DesignRecord;
import com.tabledesigner.model.FieldSpec;
import com.tabledesigner.model.TableDesign;
import com.tabledesigner.model.TableDetail;
import com.tabledesigner.model.TableStructure;
import com.tabledesigner.store.DesignStore;
import com.tabledesigner.store.DesignStoreException;
import com.tabledesigner.store.TableCommentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies table designs to the live schema and keeps the design store in step with it.
 *
 * <p>Every mutation holds the table's lock from reading the current design until the new design is
 * recorded. The design store is only written after the engine accepted the DDL. The two writes are
 * not atomic together: when the second one fails the caller gets
 * {@link DesignPersistenceFailedException} and {@link #reconcile(String)} repairs the record.
 *
 * <p>A rebuild drops and recreates the table inside one engine transaction, so a rejected
 * {@code CREATE} leaves the old table in place. Unless row preservation is enabled, a rebuild loses
 * every row of the table, not only the values of the changed column.
 */
@Slf4j
@Service
public class SchemaSynchronizer {
    static final String STAGING_PREFIX = "__rebuild_";
    static final String UNTYPED_COLUMN_TYPE = "BLOB";
    private static final Pattern SIZED_TYPE = Pattern.compile("^\\s*([A-Za-z][A-Za-z0-9_ ]*?)\\s*\\(\\s*(\\d+)\\s*\\)\\s*$");

    private final CatalogGateway catalogGateway;
    private final SchemaInspector schemaInspector;
    private final DesignStore designStore;
    private final TableCommentStore commentStore;
    private final TableLockRegistry lockRegistry;
    private final AlterationMode alterationMode;
    private final boolean preserveRows;

    public SchemaSynchronizer(
            CatalogGateway catalogGateway,
            SchemaInspector schemaInspector,
            DesignStore designStore,
            TableCommentStore commentStore,
            TableLockRegistry lockRegistry,
            DesignerSettings settings
    ) {
        this.catalogGateway = catalogGateway;
        this.schemaInspector = schemaInspector;
        this.designStore = designStore;
        this.commentStore = commentStore;
        this.lockRegistry = lockRegistry;
        this.alterationMode = settings.alterationMode();
        this.preserveRows = settings.preserveRows();
    }

    /**
     * Creates the table of a design, or rebuilds it when a table of that name already exists.
     *
     * @param design full design
     * @return the recorded design
     */
    public DesignRecord createOrReplace(TableDesign design) {
        DdlBuilder.validateDesign(design);
        return lockRegistry.withLock(design.getName(), () -> applyDesign(design, Map.of()));
    }

    /**
     * Replaces the design of an existing table. The design is keyed to {@code tableName} whatever
     * name its body carries.
     *
     * @param tableName existing table
     * @param design full replacement design
     * @return the recorded design
     */
    public DesignRecord replace(String tableName, TableDesign design) {
        if (design == null) {
            throw new InvalidDesignException("Table design is required");
        }
        TableDesign keyed = design.withFields(tableName,
                design.getFields() != null ? design.getFields() : List.of());
        DdlBuilder.validateDesign(keyed);
        return lockRegistry.withLock(tableName, () -> {
            requireTable(tableName);
            return applyDesign(keyed, Map.of());
        });
    }

    /**
     * Adds one column in place.
     *
     * <p>Primary key and unique columns cannot be added to an existing SQLite table, so those go
     * through a rebuild and need a recorded design. A table without a recorded design stays
     * untracked: the column is added and nothing is recorded.
     *
     * @param tableName existing table
     * @param field new field
     * @return the updated record, empty when the table is untracked
     */
    public Optional<DesignRecord> addField(String tableName, FieldSpec field) {
        DdlBuilder.validateField(field);
        return lockRegistry.withLock(tableName, () -> {
            requireTable(tableName);
            Optional<DesignRecord> record = designStore.get(tableName);
            if (record.isPresent() && record.get().getDesign().findField(field.getName()).isPresent()) {
                throw new DuplicateFieldException("Field " + field.getName() + " already exists in table " + tableName);
            }
            TableStructure live = schemaInspector.describe(tableName);
            if (live.findColumn(field.getName()).isPresent()) {
                throw new DuplicateFieldException("Column " + field.getName() + " already exists in table " + tableName);
            }

            if (!alterationMode.canAddInPlace(field)) {
                TableDesign current = record
                        .orElseThrow(() -> new DesignNotFoundException(
                                "Adding a primary key or unique column rebuilds the table, which needs a recorded design of " + tableName))
                        .getDesign();
                List<FieldSpec> fields = new ArrayList<>(current.getFields());
                fields.add(field);
                return Optional.of(applyDesign(current.withFields(current.getName(), fields), Map.of()));
            }

            catalogGateway.executeInTransaction(List.of(DdlBuilder.buildAddColumn(tableName, field)));
            if (record.isEmpty()) {
                log.warn("Added column {} to untracked table {}; no design recorded", field.getName(), tableName);
                return Optional.empty();
            }
            TableDesign current = record.get().getDesign();
            List<FieldSpec> fields = new ArrayList<>(current.getFields());
            fields.add(field);
            DesignRecord updated = persist(current.withFields(current.getName(), fields));
            log.info("Added field {} to table {}", field.getName(), tableName);
            return Optional.of(updated);
        });
    }

    /**
     * Removes a field from the recorded design and from the live table.
     *
     * @param tableName table with a recorded design
     * @param fieldName field to remove
     * @return the updated record
     */
    public DesignRecord removeField(String tableName, String fieldName) {
        return lockRegistry.withLock(tableName, () -> {
            TableDesign current = designStore.require(tableName).getDesign();
            FieldSpec removed = current.findField(fieldName)
                    .orElseThrow(() -> new FieldNotFoundException("Field " + fieldName + " does not exist in table " + tableName));
            List<FieldSpec> remaining = new ArrayList<>(current.getFields());
            remaining.remove(removed);
            if (remaining.isEmpty()) {
                throw new InvalidDesignException("Cannot remove " + fieldName + ": table " + tableName + " must keep at least one field");
            }
            TableDesign next = current.withFields(current.getName(), remaining);

            if (alterationMode.canDropInPlace(removed) && catalogGateway.exists(current.getName())) {
                catalogGateway.executeInTransaction(List.of(DdlBuilder.buildDropColumn(current.getName(), removed.getName())));
                DesignRecord updated = persist(next);
                log.info("Dropped column {} of table {} in place", removed.getName(), tableName);
                return updated;
            }
            return applyDesign(next, Map.of());
        });
    }

    /**
     * Replaces a field definition at the same position in the recorded design and applies it.
     *
     * @param tableName table with a recorded design
     * @param fieldName field to replace
     * @param newField replacement, possibly under a new name
     * @return the updated record
     */
    public DesignRecord updateField(String tableName, String fieldName, FieldSpec newField) {
        DdlBuilder.validateField(newField);
        return lockRegistry.withLock(tableName, () -> {
            TableDesign current = designStore.require(tableName).getDesign();
            FieldSpec existing = current.findField(fieldName)
                    .orElseThrow(() -> new FieldNotFoundException("Field " + fieldName + " does not exist in table " + tableName));
            if (!existing.getName().equalsIgnoreCase(newField.getName())
                    && current.findField(newField.getName()).isPresent()) {
                throw new DuplicateFieldException("Field " + newField.getName() + " already exists in table " + tableName);
            }

            List<FieldSpec> fields = new ArrayList<>(current.getFields());
            fields.set(fields.indexOf(existing), newField);
            TableDesign next = current.withFields(current.getName(), fields);

            if (alterationMode.canRenameInPlace(existing, newField) && catalogGateway.exists(current.getName())) {
                catalogGateway.executeInTransaction(List.of(
                        DdlBuilder.buildRenameColumn(current.getName(), existing.getName(), newField.getName())));
                DesignRecord updated = persist(next);
                log.info("Renamed column {} of table {} to {} in place", existing.getName(), tableName, newField.getName());
                return updated;
            }
            return applyDesign(next, Map.of(newField.getName(), existing.getName()));
        });
    }

    /**
     * Drops the live table, then its design record and comment.
     *
     * @param tableName existing table
     */
    public void drop(String tableName) {
        lockRegistry.runWithLock(tableName, () -> {
            String canonical = requireTable(tableName);
            catalogGateway.executeInTransaction(List.of(DdlBuilder.buildDropTable(canonical)));
            try {
                designStore.delete(tableName);
            } catch (DesignStoreException e) {
                log.error("Table {} was dropped but its design record could not be deleted", tableName, e);
                throw new DesignPersistenceFailedException(tableName,
                        "Table " + tableName + " was dropped but its design record could not be deleted: " + e.getMessage(), e);
            }
            commentStore.delete(tableName);
            log.info("Dropped table {}", tableName);
        });
    }

    /**
     * Rewrites the design record of a table from its live structure, keeping the recorded comment.
     *
     * @param tableName existing table
     * @return the recorded design
     */
    public DesignRecord reconcile(String tableName) {
        return lockRegistry.withLock(tableName, () -> {
            TableStructure live = schemaInspector.describe(tableName);
            String comment = designStore.get(tableName)
                    .map(r -> r.getDesign().getComment())
                    .or(() -> commentStore.find(tableName))
                    .orElse(null);
            TableDesign derived = designFromStructure(live);
            derived.setComment(comment);
            try {
                DdlBuilder.validateDesign(derived);
            } catch (InvalidDesignException e) {
                throw new InvalidDesignException("Table " + live.getName()
                        + " cannot be described as a design: " + e.getMessage());
            }
            DesignRecord updated = persist(derived);
            log.info("Reconciled design of table {} from live schema ({} fields)", live.getName(), derived.getFields().size());
            return updated;
        });
    }

    public TableDetail detail(String tableName) {
        TableStructure structure = schemaInspector.describe(tableName);
        TableDesign design = designStore.get(tableName).map(DesignRecord::getDesign).orElse(null);
        boolean inSync = design != null && schemaInspector.isConsistent(structure, design);
        if (design != null && !inSync) {
            log.warn("Table {} has drifted from its recorded design", tableName);
        }
        return TableDetail.builder()
                .structure(structure)
                .design(design)
                .inSync(inSync)
                .build();
    }

    /**
     * Derives a design from a live table. A declared type such as {@code VARCHAR(50)} is split into
     * type and length; other declared types are kept verbatim. A column declared without a type gets
     * {@code BLOB}, the type whose affinity matches an untyped column.
     */
    static TableDesign designFromStructure(TableStructure structure) {
        List<FieldSpec> fields = new ArrayList<>();
        for (ColumnInfo column : structure.getColumns()) {
            String declared = column.getType() == null || column.getType().isBlank() ? UNTYPED_COLUMN_TYPE : column.getType();
            FieldSpec field = new FieldSpec(column.getName(), declared);
            Matcher m = SIZED_TYPE.matcher(declared);
            if (m.matches()) {
                field.setType(m.group(1).trim());
                field.setLength(Integer.parseInt(m.group(2)));
            }
            field.setNullable(column.isNullable());
            field.setPrimary(column.isPrimaryKey());
            field.setUnique(column.isUnique());
            field.setDefaultValue(column.getDefaultValue());
            fields.add(field);
        }
        return new TableDesign(structure.getName(), fields);
    }

    private DesignRecord applyDesign(TableDesign design, Map<String, String> renamedFrom) {
        boolean exists = catalogGateway.exists(design.getName());
        List<String> statements = exists
                ? rebuildStatements(design, renamedFrom)
                : List.of(DdlBuilder.buildCreate(design));
        catalogGateway.executeInTransaction(statements);

        DesignRecord record = persist(design);
        commentStore.save(design.getName(), design.getComment());
        log.info("{} table {} with {} fields (design version {})",
                exists ? "Rebuilt" : "Created", design.getName(), design.getFields().size(), record.getVersion());
        return record;
    }

    private List<String> rebuildStatements(TableDesign design, Map<String, String> renamedFrom) {
        String table = design.getName();
        if (!preserveRows) {
            return List.of(DdlBuilder.buildDropTable(table), DdlBuilder.buildCreate(design));
        }

        TableStructure live = schemaInspector.describe(table);
        String staging = STAGING_PREFIX + table;
        Map<String, String> copied = new LinkedHashMap<>();
        for (FieldSpec field : design.getFields()) {
            String source = renamedFrom.getOrDefault(field.getName(), field.getName());
            live.findColumn(source).ifPresent(column -> copied.put(field.getName(), column.getName()));
        }

        List<String> statements = new ArrayList<>();
        statements.add(DdlBuilder.buildDropTableIfExists(staging));
        statements.add(DdlBuilder.buildCreate(design.withFields(staging, design.getFields())));
        if (!copied.isEmpty()) {
            statements.add(DdlBuilder.buildCopyRows(staging, live.getName(), copied));
        }
        statements.add(DdlBuilder.buildDropTable(live.getName()));
        statements.add(DdlBuilder.buildRenameTable(staging, table));
        return statements;
    }

    private DesignRecord persist(TableDesign design) {
        try {
            return designStore.put(design);
        } catch (DesignStoreException e) {
            log.error("Schema of table {} changed but its design record was not updated", design.getName(), e);
            throw new DesignPersistenceFailedException(design.getName(),
                    "Schema of table " + design.getName() + " changed but its design could not be recorded: " + e.getMessage(), e);
        }
    }

    private String requireTable(String tableName) {
        String canonical = SqlLiterals.isValidIdentifier(tableName) ? catalogGateway.canonicalName(tableName) : null;
        if (canonical == null) {
            throw new TableNotFoundException("Table " + tableName + " does not exist");
        }
        return canonical;
    }
}
