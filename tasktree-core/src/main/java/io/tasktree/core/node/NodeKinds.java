package io.tasktree.core.node;

/// Kind tags of the built-in node types, as they appear in traces.
public final class NodeKinds {

    private NodeKinds() {}

    public static final String TREE = "Tree";

    public static final String FUNCTION = "Function";
    public static final String ASSERT = "Assert";
    public static final String WRITE_BLACKBOARD = "WriteBlackboard";
    public static final String PARSE_JSON = "ParseJSON";
    public static final String LOG = "Log";
    public static final String FAILURE = "Failure";
    public static final String CONSTANT = "Constant";
    public static final String LLM = "LLM";

    public static final String SEQUENCE = "Sequence";
    public static final String SELECTOR = "Selector";
    public static final String RANDOM_SELECTOR = "RandomSelector";
    public static final String PARALLEL = "Parallel";
    public static final String GATHER = "Gather";
    public static final String WHILE = "While";

    public static final String IF = "If";
    public static final String ELSE = "Else";
    public static final String INVERT = "Invert";
    public static final String FORCE_OK = "ForceOk";
    public static final String FORCE_FAIL = "ForceFail";
    public static final String RETURN = "Return";
    public static final String RETRY = "Retry";
    public static final String TIMEOUT = "Timeout";
    public static final String TERMINABLE = "Terminable";
    public static final String FALLBACK = "Fallback";
    public static final String WRAPPER = "Wrapper";
    public static final String CACHER = "Cacher";
    public static final String SUBTREE = "Subtree";
}
