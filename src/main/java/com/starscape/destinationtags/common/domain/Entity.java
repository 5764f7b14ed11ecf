package com.starscape.destinationtags.common.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base class for identity-bearing domain objects.
 * Two entities are equal when they are of the same type and carry the same id.
 */
public abstract class Entity<ID extends Serializable> {
    
    private final ID id;
    
    protected Entity(ID id) {
        this.id = id;
    }
    
    public ID getId() {
        return id;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity<?> that = (Entity<?>) o;
        return id != null && Objects.equals(id, that.id);
    }
    
    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }
}
