/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.prepdb;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link DatabaseDriver} backed by {@link DriverManager}.
 * <p>
 * A {@code host} that starts with {@code jdbc:} is used as the connection URL as-is; any other {@code host} is
 * substituted into the URL template, <code>{@value #DEFAULT_URL_TEMPLATE}</code> unless configured otherwise.
 * <p>
 * The selected database is read back from the connection after selection, since some drivers accept a schema
 * that does not exist.
 * <p>
 * No session option is needed for native numeric results: {@link java.sql.ResultSet#getObject(int)} already returns
 * numeric columns as {@link Integer}, {@link Long}, {@link Double} or {@link java.math.BigDecimal} rather than text.
 * Driver-specific options can still be supplied as connection properties.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class JdbcDatabaseDriver implements DatabaseDriver {
	@NonNull
	public static final String DEFAULT_URL_TEMPLATE = "jdbc:mysql://%s/";

	@NonNull
	private final String urlTemplate;
	@NonNull
	private final Properties connectionProperties;

	public JdbcDatabaseDriver() {
		this(DEFAULT_URL_TEMPLATE, null);
	}

	/**
	 * Creates a driver with the given URL template and extra connection properties.
	 *
	 * @param urlTemplate          a {@link String#format(String, Object...)} pattern with one {@code %s} for the host
	 * @param connectionProperties driver-specific properties passed along with the credentials, may be {@code null}
	 */
	public JdbcDatabaseDriver(@NonNull String urlTemplate,
														@Nullable Properties connectionProperties) {
		requireNonNull(urlTemplate);

		if (!urlTemplate.contains("%s"))
			throw new IllegalArgumentException(format("URL template '%s' has no %%s placeholder for the host", urlTemplate));

		this.urlTemplate = urlTemplate;
		this.connectionProperties = new Properties();

		if (connectionProperties != null)
			this.connectionProperties.putAll(connectionProperties);
	}

	@NonNull
	@Override
	public Connection connect(@NonNull String host,
														@Nullable String username,
														@Nullable String password) throws SQLException {
		requireNonNull(host);

		Properties properties = new Properties();
		properties.putAll(getConnectionProperties());

		if (username != null)
			properties.setProperty("user", username);
		if (password != null)
			properties.setProperty("password", password);

		return DriverManager.getConnection(determineUrl(host), properties);
	}

	@Override
	public void selectDatabase(@NonNull Connection connection,
														 @NonNull DatabaseType databaseType,
														 @NonNull String databaseName) throws SQLException {
		requireNonNull(connection);
		requireNonNull(databaseType);
		requireNonNull(databaseName);

		String selectedDatabaseName;

		if (databaseType == DatabaseType.MYSQL) {
			connection.setCatalog(databaseName);
			selectedDatabaseName = connection.getCatalog();
		} else {
			connection.setSchema(databaseName);
			selectedDatabaseName = connection.getSchema();
		}

		if (selectedDatabaseName == null || !selectedDatabaseName.equalsIgnoreCase(databaseName))
			throw new SQLException(format("Unknown database '%s'", databaseName));
	}

	/**
	 * Builds the JDBC URL for {@code host}.
	 *
	 * @param host a JDBC URL, or a host to substitute into the URL template
	 * @return the JDBC URL to connect to
	 */
	@NonNull
	protected String determineUrl(@NonNull String host) {
		requireNonNull(host);

		if (host.startsWith("jdbc:"))
			return host;

		return format(getUrlTemplate(), host);
	}

	@NonNull
	protected String getUrlTemplate() {
		return this.urlTemplate;
	}

	@NonNull
	protected Properties getConnectionProperties() {
		return this.connectionProperties;
	}
}
