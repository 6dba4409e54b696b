/**
 * JDBC implementation of the switchboard's store capability: one connection per session, URL
 * derived from a template.
 */
package com.switchboard.database.store;
