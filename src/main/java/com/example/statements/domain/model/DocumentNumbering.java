package com.example.statements.domain.model;

/**
 * Numbers assigned to a banking document at confirmation time.
 *
 * @param accountGroupNumber case-scoped account group, e.g. {@code "2"}
 * @param documentNumber     {@code "{group}.{sequence}"}, e.g. {@code "2.3"}
 */
public record DocumentNumbering(String accountGroupNumber, String documentNumber) {

    /**
     * @param accountGroupNumber group number
     * @param sequence           1-based position inside the group
     * @return numbering in canonical format
     */
    public static DocumentNumbering of(String accountGroupNumber, int sequence) {
        return new DocumentNumbering(accountGroupNumber, accountGroupNumber + "." + sequence);
    }
}
