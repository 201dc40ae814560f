package com.apidoc.generator.render.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class NamespacePage {

    @NonNull
    String title;

    int weight;

    String summary;

    @Singular
    List<MemberGroup> memberGroups;
}
