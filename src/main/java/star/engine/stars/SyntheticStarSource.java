package star.engine.stars;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;

import star.engine.build.SourceRecord;

/**
 * Deterministic star stream for demos and load tests. Starts with a handful of named
 * bright stars, followed by random stars spread uniformly over the sphere with a
 * magnitude distribution skewed towards faint stars. The same seed yields the same
 * stream; each iterator() replays it from the start.
 */
public final class SyntheticStarSource implements Iterable<SourceRecord> {

    private static final String[] CONSTELLATIONS = {
        "and","ant","aps","aqr","aql","ara","ari","aur","boo","cae","cam","cnc","cvn","cma","cmi","cap",
        "car","cas","cen","cep","cet","cha","cir","col","com","cra","crb","crv","crt","cru","cyg","del",
        "dor","dra","equ","eri","for","gem","gru","her","hor","hya","hyi","ind","lac","leo","lmi","lep",
        "lib","lup","lyn","lyr","men","mic","mon","mus","nor","oct","oph","ori","pav","peg","per","phe",
        "pic","psc","psa","pup","pyx","ret","sge","sgr","sco","scl","sct","ser","sex","tau","tel","tri",
        "tra","tuc","uma","umi","vel","vir","vol","vul"
    };

    /** Named bright stars, J2000 positions. */
    static final List<SourceRecord> BRIGHT_STARS = List.of(
        StarRecords.star().hip(32349).name("Sirius").position(101.28715533, -16.71611586).magnitude(-1.44)
            .bv(0.009).parallaxMas(379.21).raMasPerYear(-546.01).decMasPerYear(-1223.07)
            .constellationId("cma").ccdm("06451-1643").build(),
        StarRecords.star().hip(30438).name("Canopus").position(95.98795779, -52.69566138).magnitude(-0.62)
            .bv(0.164).parallaxMas(10.55).raMasPerYear(19.93).decMasPerYear(23.24).constellationId("car").build(),
        StarRecords.star().hip(69673).name("Arcturus").position(213.91530029, 19.18240916).magnitude(-0.05)
            .bv(1.239).parallaxMas(88.83).raMasPerYear(-1093.45).decMasPerYear(-1999.4).constellationId("boo").build(),
        StarRecords.star().hip(91262).name("Vega").position(279.23473479, 38.78368896).magnitude(0.03)
            .bv(-0.001).parallaxMas(128.93).raMasPerYear(201.02).decMasPerYear(287.46).constellationId("lyr").build(),
        StarRecords.star().hip(24608).name("Capella").position(79.17232794, 45.99799147).magnitude(0.08)
            .bv(0.795).parallaxMas(77.29).raMasPerYear(75.52).decMasPerYear(-427.13).constellationId("aur").build(),
        StarRecords.star().hip(24436).name("Rigel").position(78.63446707, -8.20163837).magnitude(0.18)
            .bv(-0.03).parallaxMas(3.78).raMasPerYear(1.87).decMasPerYear(-0.56).constellationId("ori").build(),
        StarRecords.star().hip(11767).name("Polaris").position(37.95456067, 89.26410897).magnitude(1.97)
            .bv(0.636).parallaxMas(7.54).raMasPerYear(44.22).decMasPerYear(-11.74).constellationId("umi").build()
    );

    private final long count;
    private final long seed;

    /** @param count total number of records, named stars included */
    public SyntheticStarSource(long count, long seed) {
        if (count < 0) throw new IllegalArgumentException("count must not be negative");
        this.count = count;
        this.seed = seed;
    }

    public long count() { return count; }

    @Override
    public Iterator<SourceRecord> iterator() {
        Random rnd = new Random(seed);
        return new Iterator<>() {
            private long produced;

            @Override
            public boolean hasNext() {
                return produced < count;
            }

            @Override
            public SourceRecord next() {
                if (!hasNext()) throw new NoSuchElementException();
                long i = produced++;
                if (i < BRIGHT_STARS.size()) return BRIGHT_STARS.get((int) i);
                return randomStar(rnd, i);
            }
        };
    }

    private static SourceRecord randomStar(Random rnd, long i) {
        double ra = rnd.nextDouble() * 360.0;
        double dec = Math.toDegrees(Math.asin(2.0 * rnd.nextDouble() - 1.0));
        // star counts grow roughly tenfold every few magnitudes, so favour the faint end
        double magnitude = round(16.0 - 17.0 * Math.pow(rnd.nextDouble(), 4), 2);
        StarRecords.Builder b = StarRecords.star()
            .position(ra, dec)
            .magnitude(magnitude)
            .tyc((1 + rnd.nextInt(9537)) + "-" + (1 + rnd.nextInt(12121)) + "-1")
            .constellationId(CONSTELLATIONS[rnd.nextInt(CONSTELLATIONS.length)]);
        if (magnitude < 12.0) b.hip(100_000 + (int) i);
        if (rnd.nextInt(4) != 0) b.bv(round(-0.3 + rnd.nextDouble() * 2.3, 3));
        if (rnd.nextInt(3) != 0) b.parallaxMas(round(rnd.nextDouble() * 50.0, 2));
        if (rnd.nextInt(5) != 0) {
            b.raMasPerYear(round(rnd.nextGaussian() * 20.0, 2));
            b.decMasPerYear(round(rnd.nextGaussian() * 20.0, 2));
        }
        return b.build();
    }

    private static double round(double v, int digits) {
        double scale = Math.pow(10, digits);
        return Math.round(v * scale) / scale;
    }
}
