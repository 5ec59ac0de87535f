package org.sqlver.model.change;

import org.sqlver.model.Ordered;
import org.sqlver.model.SchemaObjectType;

import java.util.List;

/**
 * An authored delta that moves an object from the previous version to the current one. Either a
 * {@link SchemaChange} (add, remove, rename, alter) or an explicit {@link SqlChange}.
 */
public sealed interface Change extends Ordered permits SchemaChange, SqlChange {

    String getComment();

    /** Kind of object the change applies to. */
    SchemaObjectType getObjectType();

    ChangeType getChangeType();

    /**
     * Names of the objects this change impacts. The object a change is attached to is not
     * necessarily listed.
     */
    List<String> getAffects();
}
