package com.triagedesk.support.desk.service;

import com.triagedesk.support.desk.model.WorkItem;

import java.util.List;

public record WorkItemPage(List<WorkItem> items, int total, int offset, int limit) {
}
