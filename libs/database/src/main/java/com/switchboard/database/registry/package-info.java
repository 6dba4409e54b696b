/**
 * The tenant registry persisted in the shared registry database.
 */
package com.switchboard.database.registry;
