package br.ufmg.cs.systems.chemgraph.registry;

import br.ufmg.cs.systems.chemgraph.conf.Configuration;
import br.ufmg.cs.systems.chemgraph.isomorphism.GraphMatcher;
import br.ufmg.cs.systems.chemgraph.molecule.Molecule;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pool of known species, deduplicated up to isomorphism. Molecules are
 * bucketed by {@link MoleculeFingerprint} and compared within a bucket by
 * exact isomorphism. Registered molecules are copied, so later edits of the
 * caller's instance do not affect the pool. Not thread-safe.
 *
 * @param <T> value attached to each species
 */
public class SpeciesRegistry<T> {
   private static final Logger LOG = Logger.getLogger(SpeciesRegistry.class);

   private final GraphMatcher matcher;
   private final int fingerprintRounds;
   private final Map<MoleculeFingerprint, List<Entry<T>>> buckets;
   private int size;

   public SpeciesRegistry() {
      this(GraphMatcher.getDefault());
   }

   public SpeciesRegistry(GraphMatcher matcher) {
      this.matcher = matcher;
      Configuration conf = matcher.getConfiguration();
      this.fingerprintRounds = conf.getFingerprintRounds();
      this.buckets = new HashMap<>();
   }

   /**
    * Adds the molecule unless an isomorphic one is already present.
    *
    * @return the entry now representing the species, new or existing
    */
   public Entry<T> register(Molecule molecule, T value) {
      MoleculeFingerprint fingerprint = fingerprint(molecule);
      Entry<T> existing = find(molecule, fingerprint);
      if (existing != null) {
         return existing;
      }

      Entry<T> entry = new Entry<>(molecule.copy(), value, size);
      buckets.computeIfAbsent(fingerprint, k -> new ArrayList<>()).add(entry);
      ++size;

      if (LOG.isDebugEnabled()) {
         LOG.debug(String.format("Registered species #%d %s", entry.getIndex(),
                 fingerprint));
      }

      return entry;
   }

   /**
    * @return the entry of an isomorphic registered molecule, or null
    */
   public Entry<T> find(Molecule molecule) {
      return find(molecule, fingerprint(molecule));
   }

   private Entry<T> find(Molecule molecule, MoleculeFingerprint fingerprint) {
      List<Entry<T>> bucket = buckets.get(fingerprint);
      if (bucket == null) {
         return null;
      }

      for (Entry<T> entry : bucket) {
         if (matcher.isIsomorphic(entry.getMolecule(), molecule)) {
            return entry;
         }
      }

      return null;
   }

   public boolean contains(Molecule molecule) {
      return find(molecule) != null;
   }

   public int size() {
      return size;
   }

   public boolean isEmpty() {
      return size == 0;
   }

   public void clear() {
      buckets.clear();
      size = 0;
   }

   private MoleculeFingerprint fingerprint(Molecule molecule) {
      return MoleculeFingerprint.of(molecule, fingerprintRounds);
   }

   public static final class Entry<T> {
      private final Molecule molecule;
      private final T value;
      private final int index;

      private Entry(Molecule molecule, T value, int index) {
         this.molecule = molecule;
         this.value = value;
         this.index = index;
      }

      public Molecule getMolecule() {
         return molecule;
      }

      public T getValue() {
         return value;
      }

      /**
       * Registration order, starting at zero.
       */
      public int getIndex() {
         return index;
      }

      @Override
      public String toString() {
         return "Entry{" +
                 "index=" + index +
                 ",value=" + value +
                 '}';
      }
   }
}
