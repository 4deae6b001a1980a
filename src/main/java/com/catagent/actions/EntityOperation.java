package com.catagent.actions;

public enum EntityOperation {
    CREATE, UPDATE, PUBLISH, DELETE
}
