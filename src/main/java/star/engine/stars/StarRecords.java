package star.engine.stars;

import star.engine.build.SourceRecord;

/**
 * Builds star source records. Missing proper-motion rates become 0 and the epoch
 * defaults to J2000; every other unset field stays absent.
 */
public final class StarRecords {
    private StarRecords() {}

    public static Builder star() {
        return new Builder();
    }

    public static final class Builder {
        private Integer hip;
        private String tyc;
        private String name;
        private Double ra;
        private Double dec;
        private Double magnitude;
        private Double bv;
        private Double parallaxMas;
        private Double raMasPerYear;
        private Double decMasPerYear;
        private String constellationId;
        private String ccdm;
        private int epochYear = StarSchema.EPOCH_J2000;

        public Builder hip(Integer hip) { this.hip = hip; return this; }
        public Builder tyc(String tyc) { this.tyc = tyc; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder ra(Double ra) { this.ra = ra; return this; }
        public Builder dec(Double dec) { this.dec = dec; return this; }
        public Builder magnitude(Double magnitude) { this.magnitude = magnitude; return this; }
        public Builder bv(Double bv) { this.bv = bv; return this; }
        public Builder parallaxMas(Double parallaxMas) { this.parallaxMas = parallaxMas; return this; }
        public Builder raMasPerYear(Double raMasPerYear) { this.raMasPerYear = raMasPerYear; return this; }
        public Builder decMasPerYear(Double decMasPerYear) { this.decMasPerYear = decMasPerYear; return this; }
        public Builder constellationId(String constellationId) { this.constellationId = constellationId; return this; }
        public Builder ccdm(String ccdm) { this.ccdm = ccdm; return this; }
        public Builder epochYear(int epochYear) { this.epochYear = epochYear; return this; }

        public Builder position(double ra, double dec) {
            this.ra = ra;
            this.dec = dec;
            return this;
        }

        public SourceRecord build() {
            SourceRecord.Builder b = SourceRecord.builder()
                .put(StarSchema.RA, ra)
                .put(StarSchema.DEC, dec)
                .put(StarSchema.MAGNITUDE, magnitude)
                .put(StarSchema.RA_MAS_PER_YEAR, raMasPerYear == null ? 0.0 : raMasPerYear)
                .put(StarSchema.DEC_MAS_PER_YEAR, decMasPerYear == null ? 0.0 : decMasPerYear)
                .put(StarSchema.EPOCH_YEAR, epochYear);
            if (hip != null) b.put(StarSchema.HIP, hip);
            if (tyc != null) b.put(StarSchema.TYC, tyc);
            if (name != null) b.put(StarSchema.NAME, name);
            if (bv != null) b.put(StarSchema.BV, bv);
            if (parallaxMas != null) b.put(StarSchema.PARALLAX_MAS, parallaxMas);
            if (constellationId != null) b.put(StarSchema.CONSTELLATION_ID, constellationId);
            if (ccdm != null) b.put(StarSchema.CCDM, ccdm);
            return b.build();
        }
    }
}
