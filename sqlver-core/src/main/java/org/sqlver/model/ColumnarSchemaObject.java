package org.sqlver.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A schema object that has columns: tables and views.
 */
public sealed interface ColumnarSchemaObject extends SchemaObject permits TableModel, ViewModel {

    String getCatalogName();

    String getSchemaName();

    List<ColumnModel> getColumns();

    @Override
    default List<? extends SchemaObject> getSubSchema() {
        List<SchemaObject> ret = new ArrayList<>(getColumns());
        ret.addAll(getConstraints());
        return ret;
    }

    default ColumnModel getColumnNamed(String name) {
        for (ColumnModel c : getColumns()) {
            if (c.getName().equals(name)) {
                return c;
            }
        }
        return null;
    }
}
