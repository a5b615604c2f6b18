package com.formrules.generator.codegen.model.form;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

/**
 * Item/list views generated for one repeating group. Identifiers are filled in
 * after deployment, field mappings after the mapping pass.
 */
@Data
@Builder
public class ViewPair {

    @NonNull
    private String groupName;

    @NonNull
    private View itemView;

    @NonNull
    private View listView;

    private ViewIdentifiers itemIdentifiers;

    private ViewIdentifiers listIdentifiers;

    @Builder.Default
    private List<FieldMapping> fieldMappings = new ArrayList<>();

    public String getItemViewName() {
        return itemView.getName();
    }

    public String getListViewName() {
        return listView.getName();
    }

    public boolean isDeployed() {
        return itemIdentifiers != null && listIdentifiers != null;
    }
}
