package com.tabledesigner.service;

import com.tabledesigner.model.DesignRecord;
import com.tabledesigner.model.FieldSpec;
import com.tabledesigner.model.TableDesign;
import com.tabledesigner.support.DesignerFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static com.tabledesigner.support.DesignerFixture.field;
import static com.tabledesigner.support.DesignerFixture.primary;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Row survival across the alteration strategies.
 */
class SchemaSynchronizerAlterationTest {

    @TempDir
    Path tempDir;

    private DesignerFixture fixture;

    @AfterEach
    void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    @Test
    void rebuildWithoutPreservationLosesRows() throws SQLException {
        fixture = DesignerFixture.create(tempDir);
        seedPeople();

        fixture.synchronizer.removeField("people", "age");

        assertThat(rows()).isEmpty();
    }

    @Test
    void inPlaceRemovalKeepsRows() throws SQLException {
        fixture = DesignerFixture.create(tempDir, AlterationMode.IN_PLACE, false);
        seedPeople();

        DesignRecord record = fixture.synchronizer.removeField("people", "age");

        assertThat(record.getDesign().getFields()).extracting(FieldSpec::getName).containsExactly("id", "name");
        assertThat(rows()).singleElement().isEqualTo(Map.of("id", 1, "name", "Ada"));
    }

    @Test
    void inPlaceRenameKeepsRows() throws SQLException {
        fixture = DesignerFixture.create(tempDir, AlterationMode.IN_PLACE, false);
        seedPeople();

        fixture.synchronizer.updateField("people", "name", field("display_name", "TEXT"));

        assertThat(fixture.schemaInspector.describe("people").columnNames()).containsExactly("id", "display_name", "age");
        assertThat(rows()).singleElement().satisfies(row -> assertThat(row).containsEntry("display_name", "Ada"));
    }

    @Test
    void inPlaceTypeChangeFallsBackToRebuild() throws SQLException {
        fixture = DesignerFixture.create(tempDir, AlterationMode.IN_PLACE, false);
        seedPeople();

        fixture.synchronizer.updateField("people", "age", field("age", "REAL"));

        assertThat(fixture.schemaInspector.describe("people").findColumn("age").orElseThrow().getType()).isEqualTo("REAL");
        assertThat(rows()).isEmpty();
    }

    @Test
    void preservingRebuildCopiesSurvivingAndRenamedColumns() throws SQLException {
        fixture = DesignerFixture.create(tempDir, AlterationMode.REBUILD, true);
        seedPeople();

        fixture.synchronizer.updateField("people", "name", field("full_name", "TEXT"));
        fixture.synchronizer.removeField("people", "age");

        assertThat(rows()).singleElement().isEqualTo(Map.of("id", 1, "full_name", "Ada"));
        assertThat(fixture.catalogGateway.listTables()).containsExactly("people");
    }

    @Test
    void preservingRebuildAddsUniqueColumn() throws SQLException {
        fixture = DesignerFixture.create(tempDir, AlterationMode.REBUILD, true);
        seedPeople();
        FieldSpec badge = field("badge", "TEXT");
        badge.setUnique(true);

        fixture.synchronizer.addField("people", badge);

        assertThat(rows()).singleElement().satisfies(row -> assertThat(row)
                .containsEntry("name", "Ada")
                .containsEntry("badge", null));
        assertThat(fixture.schemaInspector.describe("people").findColumn("badge").orElseThrow().isUnique()).isTrue();
    }

    private void seedPeople() {
        fixture.synchronizer.createOrReplace(new TableDesign("people",
                List.of(primary("id", "INTEGER"), field("name", "TEXT"), field("age", "INTEGER"))));
        fixture.catalogGateway.execute("INSERT INTO people (id, name, age) VALUES (1, 'Ada', 36)");
    }

    private List<Map<String, Object>> rows() {
        return fixture.catalogGateway.execute("SELECT * FROM people").getQueryResult().getRows();
    }
}
