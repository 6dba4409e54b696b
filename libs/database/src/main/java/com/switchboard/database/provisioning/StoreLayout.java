package com.switchboard.database.provisioning;

/**
 * What a physical tenant store is on the database server.
 */
public enum StoreLayout {

    /** One database per tenant ({@code CREATE DATABASE}). PostgreSQL only. */
    DATABASE,

    /** One schema per tenant inside a shared database ({@code CREATE SCHEMA}). */
    SCHEMA
}
