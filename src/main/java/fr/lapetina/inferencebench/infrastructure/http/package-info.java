/**
 * JSON over HTTP using the JDK client, with errors mapped to
 * {@link fr.lapetina.inferencebench.domain.provider.ProviderException}.
 */
package fr.lapetina.inferencebench.infrastructure.http;
