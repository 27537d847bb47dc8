/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the collaborators the fan-out engine depends on but does not implement.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fanout.core.spi.CredentialProvider} - Role assumption</li>
 *   <li>{@link com.ryuqq.fanout.core.spi.OrganizationDirectory} - OU and account listing</li>
 *   <li>{@link com.ryuqq.fanout.core.spi.RegionOperation} - Per account-region unit of work</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (fanout-adapter-inmemory, fanout-adapter-aws) provide concrete
 * implementations of the provider and directory SPIs. RegionOperation is supplied by the caller.</p>
 *
 * @since 1.0.0
 * @author FanOut Team
 */
package com.ryuqq.fanout.core.spi;
