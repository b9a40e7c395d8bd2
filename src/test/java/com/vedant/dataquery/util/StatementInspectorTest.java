package com.vedant.dataquery.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatementInspectorTest {

    @Test
    void acceptsReadOnlyStatements() {
        assertTrue(StatementInspector.isReadOnly("SELECT * FROM t"));
        assertTrue(StatementInspector.isReadOnly("  with x as (select 1) select * from x"));
        assertTrue(StatementInspector.isReadOnly("-- top rows\nSELECT 1"));
        assertTrue(StatementInspector.isReadOnly("/* note */ select 1"));
        assertTrue(StatementInspector.isReadOnly("(SELECT 1) UNION (SELECT 2)"));
        assertTrue(StatementInspector.isReadOnly("DESCRIBE t"));
    }

    @Test
    void rejectsStatementsThatChangeTheCatalog() {
        assertFalse(StatementInspector.isReadOnly("INSERT INTO t VALUES (1)"));
        assertFalse(StatementInspector.isReadOnly("update t set a = 1"));
        assertFalse(StatementInspector.isReadOnly("DELETE FROM t"));
        assertFalse(StatementInspector.isReadOnly("DROP TABLE t"));
        assertFalse(StatementInspector.isReadOnly("CREATE TABLE x AS SELECT 1"));
        assertFalse(StatementInspector.isReadOnly("ATTACH 'other.db'"));
        assertFalse(StatementInspector.isReadOnly("   "));
        assertFalse(StatementInspector.isReadOnly(null));
    }

    @Test
    void everyStatementMustBeReadOnly() {
        assertFalse(StatementInspector.isReadOnly("SELECT 1; DROP TABLE t; SELECT 2"));
        assertFalse(StatementInspector.isReadOnly("select 1;create table x as select 1"));
        assertTrue(StatementInspector.isReadOnly("SELECT 1; SELECT 2;"));
        assertTrue(StatementInspector.isReadOnly("SELECT 1; -- done"));
    }

    @Test
    void semicolonsInLiteralsAndCommentsDoNotSplit() {
        assertEquals(1, StatementInspector.statements("SELECT ';DROP TABLE t' AS s").size());
        assertEquals(1, StatementInspector.statements("SELECT 'it''s; fine'").size());
        assertEquals(1, StatementInspector.statements("SELECT \"a;b\" FROM t /* x; y */").size());
        assertEquals(1, StatementInspector.statements("SELECT 1 -- a; b\n").size());
        assertEquals(2, StatementInspector.statements("SELECT 1;\n SELECT ';'").size());
        assertTrue(StatementInspector.statements("  ;; ").isEmpty());
    }

    @Test
    void findsLeadingKeyword() {
        assertEquals("select", StatementInspector.leadingKeyword("  -- c\n SELECT 1"));
        assertEquals("drop", StatementInspector.leadingKeyword("Drop table t"));
        assertEquals("(", StatementInspector.leadingKeyword("(select 1)"));
        assertNull(StatementInspector.leadingKeyword("-- only a comment"));
    }
}
