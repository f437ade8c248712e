package com.acme.workplan.workitem;

import com.acme.workplan.domain.entity.WorkStatus;

public sealed interface FieldUpdate permits FieldUpdate.Title, FieldUpdate.Description, FieldUpdate.Status,
        FieldUpdate.Notes, FieldUpdate.Parent, FieldUpdate.OrderIndex {

    UpdatableField field();

    record Title(String value) implements FieldUpdate {
        public UpdatableField field() { return UpdatableField.TITLE; }
    }

    record Description(String value) implements FieldUpdate {
        public UpdatableField field() { return UpdatableField.DESCRIPTION; }
    }

    record Status(WorkStatus value) implements FieldUpdate {
        public UpdatableField field() { return UpdatableField.STATUS; }
    }

    record Notes(String value) implements FieldUpdate {
        public UpdatableField field() { return UpdatableField.NOTES; }
    }

    record Parent(long value) implements FieldUpdate {
        public UpdatableField field() { return UpdatableField.PARENT_ID; }
    }

    record OrderIndex(double value) implements FieldUpdate {
        public UpdatableField field() { return UpdatableField.ORDER_INDEX; }
    }
}
