/*
 * Copyright (c) 2026, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.certreq.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * X.509 subject attributes of a requested certificate
 */
public record Subject(String commonName, List<String> organizations, List<String> organizationalUnits,
                      List<String> countries, List<String> provinces, List<String> localities,
                      List<String> streetAddresses, List<String> postalCodes, String serialNumber) {

    public static final Subject EMPTY = newBuilder().build();

    public static Builder newBuilder() {
        return new Builder();
    }

    public Subject {
        commonName = commonName == null ? "" : commonName;
        serialNumber = serialNumber == null ? "" : serialNumber;
        organizations = copy(organizations);
        organizationalUnits = copy(organizationalUnits);
        countries = copy(countries);
        provinces = copy(provinces);
        localities = copy(localities);
        streetAddresses = copy(streetAddresses);
        postalCodes = copy(postalCodes);
    }

    private static List<String> copy(List<String> values) {
        return values == null ? Collections.emptyList() : List.copyOf(values);
    }

    public boolean isEmpty() {
        return commonName.isEmpty() && serialNumber.isEmpty() && organizations.isEmpty()
        && organizationalUnits.isEmpty() && countries.isEmpty() && provinces.isEmpty() && localities.isEmpty()
        && streetAddresses.isEmpty() && postalCodes.isEmpty();
    }

    public Builder toBuilder() {
        return newBuilder().setCommonName(commonName)
                           .setOrganizations(organizations)
                           .setOrganizationalUnits(organizationalUnits)
                           .setCountries(countries)
                           .setProvinces(provinces)
                           .setLocalities(localities)
                           .setStreetAddresses(streetAddresses)
                           .setPostalCodes(postalCodes)
                           .setSerialNumber(serialNumber);
    }

    public static class Builder {
        private String       commonName          = "";
        private List<String> countries           = new ArrayList<>();
        private List<String> localities          = new ArrayList<>();
        private List<String> organizationalUnits = new ArrayList<>();
        private List<String> organizations       = new ArrayList<>();
        private List<String> postalCodes         = new ArrayList<>();
        private List<String> provinces           = new ArrayList<>();
        private String       serialNumber        = "";
        private List<String> streetAddresses     = new ArrayList<>();

        public Subject build() {
            return new Subject(commonName, organizations, organizationalUnits, countries, provinces, localities,
                               streetAddresses, postalCodes, serialNumber);
        }

        public String getCommonName() {
            return commonName;
        }

        public Builder setCommonName(String commonName) {
            this.commonName = commonName;
            return this;
        }

        public List<String> getCountries() {
            return countries;
        }

        public Builder setCountries(List<String> countries) {
            this.countries = new ArrayList<>(countries);
            return this;
        }

        public List<String> getLocalities() {
            return localities;
        }

        public Builder setLocalities(List<String> localities) {
            this.localities = new ArrayList<>(localities);
            return this;
        }

        public List<String> getOrganizationalUnits() {
            return organizationalUnits;
        }

        public Builder setOrganizationalUnits(List<String> organizationalUnits) {
            this.organizationalUnits = new ArrayList<>(organizationalUnits);
            return this;
        }

        public List<String> getOrganizations() {
            return organizations;
        }

        public Builder setOrganizations(List<String> organizations) {
            this.organizations = new ArrayList<>(organizations);
            return this;
        }

        public List<String> getPostalCodes() {
            return postalCodes;
        }

        public Builder setPostalCodes(List<String> postalCodes) {
            this.postalCodes = new ArrayList<>(postalCodes);
            return this;
        }

        public List<String> getProvinces() {
            return provinces;
        }

        public Builder setProvinces(List<String> provinces) {
            this.provinces = new ArrayList<>(provinces);
            return this;
        }

        public String getSerialNumber() {
            return serialNumber;
        }

        public Builder setSerialNumber(String serialNumber) {
            this.serialNumber = serialNumber;
            return this;
        }

        public List<String> getStreetAddresses() {
            return streetAddresses;
        }

        public Builder setStreetAddresses(List<String> streetAddresses) {
            this.streetAddresses = new ArrayList<>(streetAddresses);
            return this;
        }
    }
}
