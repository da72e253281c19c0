package org.janelia.coalignment;

/**
 * Represents frame metadata: the file holding the raw cube and its acquisition date.
 */
public class FrameInfo
{
	private Integer index;
	private String file;
	private String date;

	public FrameInfo( final String file, final String date )
	{
		this.file = file;
		this.date = date;
	}

	FrameInfo() { }

	public Integer getIndex() {
		return index;
	}

	public void setIndex( final Integer index ) {
		this.index = index;
	}

	public String getFilePath() {
		return file;
	}

	public void setFilePath( final String filePath ) {
		this.file = filePath;
	}

	/**
	 * @return acquisition date in ISO-8601 local date-time format
	 */
	public String getDate() {
		return date;
	}

	public void setDate( final String date ) {
		this.date = date;
	}

	@Override
	public String toString()
	{
		return "frame " + ( index != null ? index + " " : "" ) + "(" + file + " at " + date + ")";
	}
}
