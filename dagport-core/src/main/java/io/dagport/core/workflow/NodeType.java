package io.dagport.core.workflow;

import com.google.common.base.Optional;

public enum NodeType
{
    START("start"),
    END("end"),
    KILL("kill"),
    DECISION("decision"),
    FORK("fork"),
    JOIN("join"),
    ACTION("action");

    private final String tag;

    NodeType(String tag)
    {
        this.tag = tag;
    }

    public String getTag()
    {
        return tag;
    }

    public static Optional<NodeType> ofTag(String tag)
    {
        for (NodeType type : values()) {
            if (type.tag.equals(tag)) {
                return Optional.of(type);
            }
        }
        return Optional.absent();
    }
}
