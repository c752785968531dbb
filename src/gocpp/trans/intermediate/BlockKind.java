package gocpp.trans.intermediate;

/**
 * The multi-line block currently open in the Go source. Only one may be open at a time.
 */
public enum BlockKind {
	NONE,
	IMPORT_BLOCK,
	VAR_BLOCK,
	CONST_BLOCK,
	TYPE_BLOCK,
	STRUCT_BODY,
	MAP_LITERAL_BLOCK,
}
