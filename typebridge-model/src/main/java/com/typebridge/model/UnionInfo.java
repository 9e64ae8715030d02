package com.typebridge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 联合类型元数据：用例列表和标签访问方式。
 */
public final class UnionInfo {

    private final List<UnionCaseInfo> cases;
    private final TagAccessorKind tagAccessorKind;
    private final String tagMemberName;

    public UnionInfo(List<UnionCaseInfo> cases, TagAccessorKind tagAccessorKind, String tagMemberName) {
        this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
        this.tagAccessorKind = tagAccessorKind;
        this.tagMemberName = tagMemberName;
    }

    public List<UnionCaseInfo> getCases() {
        return cases;
    }

    public UnionCaseInfo getCase(String name) {
        for (UnionCaseInfo c : cases) {
            if (c.getName().equals(name)) return c;
        }
        return null;
    }

    public TagAccessorKind getTagAccessorKind() {
        return tagAccessorKind;
    }

    public String getTagMemberName() {
        return tagMemberName;
    }

    UnionInfo instantiate(TypeDescriptor declaringType, TypeSubstitution substitution) {
        List<UnionCaseInfo> instantiated = new ArrayList<>(cases.size());
        for (UnionCaseInfo c : cases) {
            instantiated.add(c.instantiate(declaringType, substitution));
        }
        return new UnionInfo(instantiated, tagAccessorKind, tagMemberName);
    }
}
