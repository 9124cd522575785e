package com.pascals.compiler.parser;

/** Keyword spellings the grammar branches on. Comparisons are case-insensitive. */
public final class Keyword {
    public static final String PROGRAM = "program";
    public static final String CONST = "konstanta";
    public static final String TYPE = "tipe";
    public static final String VAR = "variabel";
    public static final String PROCEDURE = "prosedur";
    public static final String FUNCTION = "fungsi";
    public static final String BEGIN = "mulai";
    public static final String END = "selesai";
    public static final String IF = "jika";
    public static final String THEN = "maka";
    public static final String ELSE = "selain-itu";
    public static final String WHILE = "selama";
    public static final String DO = "lakukan";
    public static final String FOR = "untuk";
    public static final String TO = "ke";
    public static final String DOWNTO = "turun-ke";
    public static final String REPEAT = "ulangi";
    public static final String UNTIL = "sampai";
    public static final String CASE = "kasus";
    public static final String OF = "dari";
    public static final String ARRAY = "larik";
    public static final String RECORD = "rekaman";
    public static final String TRUE = "benar";
    public static final String FALSE = "salah";

    public static final String INTEGER = "integer";
    public static final String REAL = "real";
    public static final String BOOLEAN = "boolean";
    public static final String CHAR = "char";

    public static final String NOT = "tidak";
    public static final String AND = "dan";
    public static final String OR = "atau";
    public static final String DIV = "bagi";
    public static final String MOD = "mod";

    private Keyword() {}

    public static boolean isTypeName(String text) {
        return INTEGER.equalsIgnoreCase(text) || REAL.equalsIgnoreCase(text)
                || BOOLEAN.equalsIgnoreCase(text) || CHAR.equalsIgnoreCase(text);
    }
}
