package com.acme.workplan.search;

import com.acme.workplan.workitem.WorkItemDtos;

import java.util.List;

public class SearchDtos {
    public record SearchHit(WorkItemDtos.ItemResponse item, List<String> breadcrumb) {}
}
