package com.numera.backend.services.ai;

public final class ExtractionPrompts {

    private ExtractionPrompts() {}

    private static final String OUTPUT_CONTRACT =
            "Return EXACTLY one JSON object with this shape and nothing else:\n"
            + "{\n"
            + "  \"accounts\": [{ \"name\": string, \"balance\": number, \"currency\": string }],\n"
            + "  \"transactions\": [{ \"date\": \"YYYY-MM-DD\", \"description\": string, \"amount\": number, "
            + "\"category\": \"TRANSPORT\"|\"MEALS\"|\"SUPPLIES\"|\"SERVICES\"|\"TAX\"|\"PAYROLL\"|\"OTHER\" }]\n"
            + "}\n"
            + "Field rules:\n"
            + "- date: strictly YYYY-MM-DD (example: 2024-12-14)\n"
            + "- description: the counterparty or label, without extra quotes\n"
            + "- amount: decimal number, POSITIVE for income/credit, NEGATIVE for expense/debit\n"
            + "- category: exactly one of TRANSPORT, MEALS, SUPPLIES, SERVICES, TAX, PAYROLL, OTHER; use OTHER when unsure\n"
            + "- accounts: one entry per account whose closing balance is shown; empty array if none\n"
            + "No markdown, no code fences, no text before or after the object. "
            + "If nothing is found return {\"accounts\":[],\"transactions\":[]}.";

    public static final String DOCUMENT_INSTRUCTIONS =
            "You are an expert bookkeeping assistant extracting data from a bank statement. "
            + "IGNORE opening/closing balances lines, totals, titles, headers and period dates when listing transactions. "
            + "Extract ONLY individual transaction lines.\n"
            + OUTPUT_CONTRACT;

    public static final String SPREADSHEET_INSTRUCTIONS =
            "You are an expert bookkeeping assistant analysing a bank statement exported as delimited text. "
            + "Each line below is one row, cells separated by ' | '. "
            + "IGNORE header rows, total rows and empty rows. Convert dates from the export format to YYYY-MM-DD "
            + "and categorize every transaction.\n"
            + OUTPUT_CONTRACT;

    public static String documentInput(String statementText) {
        return "Extract every transaction of the following bank statement:\n\n" + statementText;
    }

    public static String spreadsheetInput(String rows) {
        return "Analyse this bank statement export and extract every transaction:\n\n" + rows;
    }
}
