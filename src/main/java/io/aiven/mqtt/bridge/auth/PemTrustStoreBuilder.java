/*
 * Copyright 2026 Aiven Oy
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
package io.aiven.mqtt.bridge.auth;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;

import org.apache.kafka.common.config.ConfigException;

import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMParser;

/**
 * Builds an in-memory trust store out of a PEM bundle of CA certificates such as
 * {@code /etc/ssl/certs/ca-certificates.crt}.
 */
public final class PemTrustStoreBuilder {

    private PemTrustStoreBuilder() {
    }

    public static KeyStore build(final Path caCertificates) {
        final var certificates = readX509Certificates(caCertificates);
        if (certificates.isEmpty()) {
            throw new ConfigException("No X.509 certificate found in " + caCertificates);
        }
        try {
            final var trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);
            for (var i = 0; i < certificates.size(); i++) {
                trustStore.setCertificateEntry("ca-" + i, certificates.get(i));
            }
            return trustStore;
        } catch (final IOException | KeyStoreException | NoSuchAlgorithmException | CertificateException e) {
            throw new ConfigException("Couldn't build trust store from " + caCertificates, e);
        }
    }

    static List<X509Certificate> readX509Certificates(final Path location) {
        final var certificates = new ArrayList<X509Certificate>();
        final var converter = new JcaX509CertificateConverter();
        try (final var pemParser = new PEMParser(Files.newBufferedReader(location))) {
            Object pemObject;
            while ((pemObject = pemParser.readObject()) != null) {
                if (pemObject instanceof X509CertificateHolder) {
                    certificates.add(converter.getCertificate((X509CertificateHolder) pemObject));
                }
            }
        } catch (final IOException ioe) {
            throw new ConfigException("Couldn't read PEM content from " + location);
        } catch (final CertificateException ce) {
            throw new ConfigException("Couldn't get X.509 certificate from " + location);
        }
        return certificates;
    }

}
