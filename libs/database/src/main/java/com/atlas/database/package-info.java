/**
 * Schema migrations and relational health probing for the Atlas control plane.
 *
 * <p>Migrations live under {@code db/migration/atlas} and follow Flyway's {@code V{n}__{desc}.sql}
 * naming. The service applies them through Spring Boot's Flyway integration at startup.
 */
package com.atlas.database;
