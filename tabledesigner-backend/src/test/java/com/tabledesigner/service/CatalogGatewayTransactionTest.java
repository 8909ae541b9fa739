package com.tabledesigner.service;

import com.tabledesigner.config.DesignerSettings;
import com.tabledesigner.error.SchemaOperationFailedException;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Connection-level failures around a schema change, which a real SQLite file cannot be made to produce.
 */
class CatalogGatewayTransactionTest {

    @Test
    void engineErrorSurvivesFailedAutoCommitRestore() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        Connection conn = mock(Connection.class);
        Statement stmt = mock(Statement.class);
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.getAutoCommit()).thenReturn(true);
        when(conn.createStatement()).thenReturn(stmt);
        when(stmt.execute(anyString())).thenThrow(new SQLException("near \"broken\": syntax error"));
        doThrow(new SQLException("connection closed")).when(conn).setAutoCommit(true);
        CatalogGateway gateway = new CatalogGateway(dataSource, DesignerSettings.defaults("live.db", "designs.db"));

        assertThatThrownBy(() -> gateway.executeInTransaction(List.of("CREATE TABLE broken (")))
                .isInstanceOf(SchemaOperationFailedException.class)
                .hasMessageContaining("syntax error")
                .satisfies(e -> assertThat(e.getCause().getSuppressed())
                        .extracting(Throwable::getMessage)
                        .containsExactly("connection closed"));
        verify(conn).rollback();
        verify(conn).close();
    }

    @Test
    void failedRollbackIsKeptBesideEngineError() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        Connection conn = mock(Connection.class);
        Statement stmt = mock(Statement.class);
        when(dataSource.getConnection()).thenReturn(conn);
        when(conn.getAutoCommit()).thenReturn(true);
        when(conn.createStatement()).thenReturn(stmt);
        when(stmt.execute(anyString())).thenThrow(new SQLException("constraint failed"));
        doThrow(new SQLException("rollback refused")).when(conn).rollback();
        CatalogGateway gateway = new CatalogGateway(dataSource, DesignerSettings.defaults("live.db", "designs.db"));

        assertThatThrownBy(() -> gateway.executeInTransaction(List.of("DROP TABLE t")))
                .isInstanceOf(SchemaOperationFailedException.class)
                .hasMessageContaining("constraint failed")
                .satisfies(e -> assertThat(e.getCause().getSuppressed())
                        .extracting(Throwable::getMessage)
                        .containsExactly("rollback refused"));
        verify(conn).setAutoCommit(true);
    }
}
