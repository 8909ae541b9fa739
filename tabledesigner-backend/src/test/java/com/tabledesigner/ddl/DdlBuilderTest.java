package com.tabledesigner.ddl;

import com.tabledesigner.error.InvalidDesignException;
import com.tabledesigner.error.InvalidFieldException;
import com.tabledesigner.model.FieldSpec;
import com.tabledesigner.model.TableDesign;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.tabledesigner.support.DesignerFixture.field;
import static com.tabledesigner.support.DesignerFixture.primary;
import static com.tabledesigner.support.DesignerFixture.usersDesign;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DdlBuilderTest {

    @Test
    void rendersCreateWithClausesInOrder() {
        assertThat(DdlBuilder.buildCreate(usersDesign())).isEqualTo(
                "CREATE TABLE \"users\" (\"id\" INTEGER, \"email\" TEXT NOT NULL UNIQUE, PRIMARY KEY (\"id\"))");
    }

    @Test
    void aggregatesAllPrimaryFieldsIntoOneCompositeKey() {
        TableDesign design = new TableDesign("memberships", List.of(
                primary("user_id", "INTEGER"),
                field("role", "TEXT"),
                primary("group_id", "INTEGER")));

        String sql = DdlBuilder.buildCreate(design);

        assertThat(sql).endsWith("PRIMARY KEY (\"user_id\", \"group_id\"))");
        assertThat(sql).containsOnlyOnce("PRIMARY KEY");
    }

    @Test
    void omitsPrimaryKeyClauseWithoutPrimaryFields() {
        String sql = DdlBuilder.buildCreate(new TableDesign("notes", List.of(field("body", "TEXT"))));

        assertThat(sql).isEqualTo("CREATE TABLE \"notes\" (\"body\" TEXT)");
    }

    @Test
    void rendersLengthAndZeroDefault() {
        FieldSpec name = field("name", "VARCHAR");
        name.setLength(50);
        FieldSpec age = field("age", "INTEGER");
        age.setDefaultValue("0");

        String sql = DdlBuilder.buildCreate(new TableDesign("people", List.of(name, age)));

        assertThat(sql).isEqualTo("CREATE TABLE \"people\" (\"name\" VARCHAR(50), \"age\" INTEGER DEFAULT 0)");
    }

    @Test
    void quotesIdentifiersContainingQuotes() {
        String sql = DdlBuilder.buildCreate(new TableDesign("odd\"name", List.of(field("a b", "TEXT"))));

        assertThat(sql).isEqualTo("CREATE TABLE \"odd\"\"name\" (\"a b\" TEXT)");
    }

    @Test
    void rejectsEmptyFieldList() {
        assertThatThrownBy(() -> DdlBuilder.buildCreate(new TableDesign("t", List.of())))
                .isInstanceOf(InvalidDesignException.class);
    }

    @Test
    void rejectsBlankFieldName() {
        assertThatThrownBy(() -> DdlBuilder.buildCreate(new TableDesign("t", List.of(field(" ", "TEXT")))))
                .isInstanceOf(InvalidDesignException.class)
                .hasMessageContaining("Field name");
    }

    @Test
    void rejectsRepeatedFieldNameIgnoringCase() {
        TableDesign design = new TableDesign("t", List.of(field("Email", "TEXT"), field("email", "TEXT")));

        assertThatThrownBy(() -> DdlBuilder.buildCreate(design))
                .isInstanceOf(InvalidDesignException.class)
                .hasMessageContaining("Duplicate field name");
    }

    @Test
    void rejectsBlankTableNameAndReservedPrefix() {
        assertThatThrownBy(() -> DdlBuilder.buildCreate(new TableDesign("", List.of(field("a", "TEXT")))))
                .isInstanceOf(InvalidDesignException.class);
        assertThatThrownBy(() -> DdlBuilder.buildCreate(new TableDesign("sqlite_x", List.of(field("a", "TEXT")))))
                .isInstanceOf(InvalidDesignException.class);
    }

    @Test
    void rejectsTypesOutsideTheTypeGrammar() {
        TableDesign design = new TableDesign("t", List.of(field("a", "TEXT); DROP TABLE users; --")));

        assertThatThrownBy(() -> DdlBuilder.buildCreate(design)).isInstanceOf(InvalidDesignException.class);
    }

    @Test
    void rejectsConstraintKeywordsInsideTheType() {
        TableDesign hiddenKey = new TableDesign("t", List.of(field("id", "INTEGER PRIMARY KEY"), field("x", "TEXT")));

        assertThatThrownBy(() -> DdlBuilder.validateDesign(hiddenKey))
                .isInstanceOf(InvalidDesignException.class)
                .hasMessageContaining("INTEGER PRIMARY KEY");
        assertThatThrownBy(() -> DdlBuilder.buildAddColumn("t", field("code", "TEXT UNIQUE")))
                .isInstanceOf(InvalidFieldException.class);
        assertThatThrownBy(() -> DdlBuilder.validateField(field("note", "TEXT NOT NULL")))
                .isInstanceOf(InvalidFieldException.class);
    }

    @Test
    void rejectsSizeGivenTwice() {
        FieldSpec f = field("a", "VARCHAR(10)");
        f.setLength(20);

        assertThatThrownBy(() -> DdlBuilder.buildAddColumn("t", f)).isInstanceOf(InvalidFieldException.class);
    }

    @Test
    void rendersAddColumnWithSameClauseRules() {
        FieldSpec status = field("status", "TEXT");
        status.setNullable(false);
        status.setDefaultValue("active");

        assertThat(DdlBuilder.buildAddColumn("users", status))
                .isEqualTo("ALTER TABLE \"users\" ADD COLUMN \"status\" TEXT NOT NULL DEFAULT 'active'");
    }

    @Test
    void addColumnRejectsBlankFieldName() {
        assertThatThrownBy(() -> DdlBuilder.buildAddColumn("users", field("", "TEXT")))
                .isInstanceOf(InvalidFieldException.class);
    }

    @Test
    void rendersRebuildStatements() {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("id", "id");
        mapping.put("mail", "email");

        assertThat(DdlBuilder.buildCopyRows("__rebuild_users", "users", mapping))
                .isEqualTo("INSERT INTO \"__rebuild_users\" (\"id\", \"mail\") SELECT \"id\", \"email\" FROM \"users\"");
        assertThat(DdlBuilder.buildRenameTable("__rebuild_users", "users"))
                .isEqualTo("ALTER TABLE \"__rebuild_users\" RENAME TO \"users\"");
        assertThat(DdlBuilder.buildRenameColumn("users", "email", "mail"))
                .isEqualTo("ALTER TABLE \"users\" RENAME COLUMN \"email\" TO \"mail\"");
        assertThat(DdlBuilder.buildDropColumn("users", "age")).isEqualTo("ALTER TABLE \"users\" DROP COLUMN \"age\"");
        assertThat(DdlBuilder.buildDropTableIfExists("t")).isEqualTo("DROP TABLE IF EXISTS \"t\"");
    }
}
