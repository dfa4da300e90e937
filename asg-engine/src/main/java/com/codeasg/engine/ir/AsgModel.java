package com.codeasg.engine.ir;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs of the JSON export of one ASG.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class AsgModel {

    private AsgModel() {}

    public static class AsgRoot {
        @SerializedName("format_version") public String formatVersion;
        @SerializedName("language")       public String language;
        @SerializedName("unit")           public String unit;
        @SerializedName("content_hash")   public String contentHash;
        @SerializedName("degraded")       public boolean degraded;
        @SerializedName("nodes")          public List<AsgNode> nodes;
        @SerializedName("edges")          public List<AsgEdge> edges;
        @SerializedName("scopes")         public List<AsgScope> scopes;
        @SerializedName("symbols")        public List<AsgSymbol> symbols;
        @SerializedName("blocks")         public List<AsgBlock> blocks;
        @SerializedName("parse_errors")   public List<AsgParseError> parseErrors;
    }

    public static class AsgNode {
        @SerializedName("id")         public String id;
        @SerializedName("kind")       public String kind;
        @SerializedName("raw_kind")   public String rawKind;   // null for synthetic entry/exit
        @SerializedName("role")       public String role;
        @SerializedName("start_byte") public int startByte;
        @SerializedName("end_byte")   public int endByte;
        @SerializedName("start_row")  public int startRow;
        @SerializedName("start_col")  public int startColumn;
        @SerializedName("end_row")    public int endRow;
        @SerializedName("end_col")    public int endColumn;
        @SerializedName("operator")   public String operator;
        @SerializedName("keyword")    public String keyword;
    }

    public static class AsgEdge {
        @SerializedName("kind")  public String kind;
        @SerializedName("from")  public String from;
        @SerializedName("to")    public String to;
        @SerializedName("label") public String label;
    }

    public static class AsgScope {
        @SerializedName("id")         public int id;
        @SerializedName("kind")       public String kind;
        @SerializedName("parent")     public Integer parent;
        @SerializedName("owner")      public String owner;
        @SerializedName("symbols")    public List<String> symbols;
    }

    public static class AsgSymbol {
        @SerializedName("id")    public String id;
        @SerializedName("name")  public String name;
        @SerializedName("kind")  public String kind;
        @SerializedName("scope") public int scope;
        @SerializedName("decl")  public String decl;
        @SerializedName("uses")  public List<String> uses;
    }

    public static class AsgBlock {
        @SerializedName("function")    public String function;
        @SerializedName("id")          public int id;
        @SerializedName("items")       public List<String> items;
        @SerializedName("successors")  public List<Integer> successors;
        @SerializedName("synthetic")   public boolean synthetic;
        @SerializedName("unreachable") public boolean unreachable;
    }

    public static class AsgParseError {
        @SerializedName("start_byte") public int startByte;
        @SerializedName("end_byte")   public int endByte;
        @SerializedName("row")        public int row;
        @SerializedName("col")        public int column;
        @SerializedName("message")    public String message;
    }
}
